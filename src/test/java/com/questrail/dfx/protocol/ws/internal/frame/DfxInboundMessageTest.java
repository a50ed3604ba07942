package com.questrail.dfx.protocol.ws.internal.frame;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DfxInboundMessageTest
{
    private static DfxInboundMessage of(String s, InboundKind kind) {
        return new DfxInboundMessage(s.getBytes(StandardCharsets.UTF_8), kind);
    }

    @Test
    void statusIsReadFromOffsetTen() {
        DfxInboundMessage m = of("0123456789200", InboundKind.SUBSCRIBE_STATUS);
        assertEquals("200", m.statusText());
        assertEquals(200, m.statusCode());
    }

    @Test
    void nonNumericStatusParsesAsMinusOne() {
        DfxInboundMessage m = of("01234567892x0 trailing", InboundKind.ADD_DATA_STATUS);
        assertEquals("2x0", m.statusText());
        assertEquals(DfxInboundMessage.UNPARSEABLE_STATUS, m.statusCode());
    }

    @Test
    void messageTooShortForStatusHasNoStatus() {
        DfxInboundMessage m = of("short", InboundKind.ADD_DATA_STATUS);
        assertEquals("", m.statusText());
        assertEquals(DfxInboundMessage.UNPARSEABLE_STATUS, m.statusCode());
        assertEquals("short", m.senderId());
        assertEquals(0, m.payload().length);
    }

    @Test
    void rawIsDefensivelyCopied() {
        byte[] raw = "0123456789200".getBytes(StandardCharsets.US_ASCII);
        DfxInboundMessage m = new DfxInboundMessage(raw, InboundKind.SUBSCRIBE_STATUS);

        raw[10] = '5';
        m.raw()[11] = '5';

        assertEquals(200, m.statusCode());
    }
}
