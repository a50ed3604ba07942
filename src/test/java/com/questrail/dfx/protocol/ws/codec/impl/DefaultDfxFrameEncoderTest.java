package com.questrail.dfx.protocol.ws.codec.impl;

import com.questrail.dfx.protocol.ws.internal.frame.DfxRequestFrame;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DefaultDfxFrameEncoderTest
{
    private final DefaultDfxFrameEncoder encoder = new DefaultDfxFrameEncoder();

    @Test
    void encodesHeaderFollowedByBody() {
        byte[] encoded = encoder.encode(new DfxRequestFrame("0510", "ffeeddccbb", new byte[] { 1, 2, 3 }));

        byte[] expectedHeader = "0510ffeeddccbb".getBytes(StandardCharsets.US_ASCII);
        assertEquals(expectedHeader.length + 3, encoded.length);
        for (int i = 0; i < expectedHeader.length; i++) {
            assertEquals(expectedHeader[i], encoded[i], "header byte " + i);
        }
        assertEquals(1, encoded[14]);
        assertEquals(2, encoded[15]);
        assertEquals(3, encoded[16]);
    }

    @Test
    void padsShortFieldsToFixedWidth() {
        byte[] encoded = encoder.encode(new DfxRequestFrame("7", "abc", new byte[0]));
        assertEquals("7   abc       ", new String(encoded, StandardCharsets.US_ASCII));
    }

    @Test
    void truncatesLongFieldsToFixedWidth() {
        byte[] encoded = encoder.encode(new DfxRequestFrame("050607", "0123456789ABCDEF", new byte[0]));
        assertEquals("05060123456789", new String(encoded, StandardCharsets.US_ASCII));
    }

    @Test
    void rejectsNullFrame() {
        assertThrows(NullPointerException.class, () -> encoder.encode(null));
    }
}
