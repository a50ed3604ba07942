package com.questrail.dfx.protocol.ws.codec.impl;

import com.questrail.dfx.protocol.ws.internal.frame.DfxRequestFrame;
import com.questrail.dfx.protocol.ws.internal.frame.InboundKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DfxFramingTest
{
    // ---------------------------------------------------------------------
    // Length classification
    // ---------------------------------------------------------------------

    @Test
    void thirteenBytesIsSubscribeStatus() {
        assertEquals(InboundKind.SUBSCRIBE_STATUS, DfxFraming.classify(new byte[13]));
    }

    @Test
    void fourteenBytesIsAddDataStatus() {
        assertEquals(InboundKind.ADD_DATA_STATUS, DfxFraming.classify(new byte[14]));
    }

    @Test
    void sixtyBytesIsAddDataStatus() {
        assertEquals(InboundKind.ADD_DATA_STATUS, DfxFraming.classify(new byte[60]));
    }

    @Test
    void sixtyOneBytesIsResultChunk() {
        assertEquals(InboundKind.RESULT_CHUNK, DfxFraming.classify(new byte[61]));
    }

    @Test
    void messagesShorterThanAStatusAreStillClassified() {
        assertEquals(InboundKind.ADD_DATA_STATUS, DfxFraming.classify(new byte[0]));
        assertEquals(InboundKind.ADD_DATA_STATUS, DfxFraming.classify(new byte[12]));
    }

    /**
     * Content that looks like a different kind must not change the outcome:
     * only the length counts.
     */
    @Test
    void classificationIgnoresContent() {
        byte[] looksLikeStatus = "ABCDEFGHIJ200".getBytes(StandardCharsets.US_ASCII);
        byte[] padded = new byte[61];
        System.arraycopy(looksLikeStatus, 0, padded, 0, looksLikeStatus.length);

        assertEquals(InboundKind.RESULT_CHUNK, DfxFraming.classify(padded));
        assertEquals(InboundKind.RESULT_CHUNK, DfxFraming.classify(padded));
    }

    @Test
    void everyLengthMapsToTheExpectedKind() {
        for (int len = 0; len <= 200; len++) {
            InboundKind expected = len == 13 ? InboundKind.SUBSCRIBE_STATUS
                    : len <= 60 ? InboundKind.ADD_DATA_STATUS
                    : InboundKind.RESULT_CHUNK;
            assertEquals(expected, DfxFraming.classifyLength(len), "length " + len);
        }
    }

    @Test
    void negativeLengthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DfxFraming.classifyLength(-1));
    }

    // ---------------------------------------------------------------------
    // Fixed-width fields
    // ---------------------------------------------------------------------

    @Test
    void shortValuesAreSpacePadded() {
        assertArrayEquals("51  ".getBytes(StandardCharsets.US_ASCII), DfxFraming.fixedWidth("51", 4));
    }

    @Test
    void longValuesAreTruncated() {
        assertArrayEquals("0123456789".getBytes(StandardCharsets.US_ASCII),
                DfxFraming.fixedWidth("0123456789abcdef", 10));
    }

    // ---------------------------------------------------------------------
    // Split
    // ---------------------------------------------------------------------

    @Test
    void splitRecoversFieldsOfEncodedRequest() {
        byte[] body = new byte[] { 0x0A, 0x03, 'a', 'b', 'c', (byte) 0xFF };
        DfxRequestFrame original = new DfxRequestFrame("0506", "a1b2c3d4e5", body);

        DfxRequestFrame split = DfxFraming.splitRequest(new DefaultDfxFrameEncoder().encode(original));

        assertEquals("0506", split.actionCode());
        assertEquals("a1b2c3d4e5", split.requestId());
        assertArrayEquals(body, split.body());
    }

    @Test
    void splitAcceptsHeaderOnlyRequest() {
        DfxRequestFrame split = DfxFraming.splitRequest("05100000000001".getBytes(StandardCharsets.US_ASCII));
        assertEquals("0510", split.actionCode());
        assertEquals("0000000001", split.requestId());
        assertEquals(0, split.body().length);
    }

    @Test
    void splitRejectsTruncatedHeader() {
        assertThrows(IllegalArgumentException.class, () -> DfxFraming.splitRequest(new byte[13]));
    }
}
