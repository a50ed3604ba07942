package com.questrail.dfx.protocol.ws.codec.impl;

import com.questrail.dfx.protocol.ws.internal.frame.DfxInboundMessage;
import com.questrail.dfx.protocol.ws.internal.frame.InboundKind;
import com.questrail.dfx.protocol.ws.transport.InboundMessages;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultDfxFrameDecoderTest
{
    private final DefaultDfxFrameDecoder decoder = new DefaultDfxFrameDecoder();

    @Test
    void decodesSubscribeStatus() {
        DfxInboundMessage m = decoder.decode(InboundMessages.subscribeStatus("abcdef0123", "404"));

        assertEquals(InboundKind.SUBSCRIBE_STATUS, m.kind());
        assertEquals("abcdef0123", m.senderId());
        assertEquals(404, m.statusCode());
    }

    @Test
    void decodesResultChunkPayloadAfterHeader() {
        byte[] payload = InboundMessages.payloadOf(100, (byte) 7);
        DfxInboundMessage m = decoder.decode(InboundMessages.resultChunk("abcdef0123", payload));

        assertEquals(InboundKind.RESULT_CHUNK, m.kind());
        assertArrayEquals(payload, m.payload());
    }

    @Test
    void keepsRawBytesUnchanged() {
        byte[] raw = InboundMessages.addDataStatus("abcdef0123", "400", "MEASUREMENT_CLOSED");
        assertArrayEquals(raw, decoder.decode(raw).raw());
    }
}
