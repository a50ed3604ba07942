package com.questrail.dfx.protocol.ws.codec;

import com.questrail.dfx.protocol.ws.internal.frame.DfxInboundMessage;

/**
 * DfxFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for inbound DFX WebSocket messages.
 *
 * <p>Decoding is a <em>total</em> function: every byte sequence maps to exactly
 * one {@link com.questrail.dfx.protocol.ws.internal.frame.InboundKind} by length.
 * Content is never inspected to infer type, and no input is rejected.</p>
 */
public interface DfxFrameDecoder
{
    /**
     * Classify and wrap one complete WebSocket message.
     *
     * @param message raw bytes received from the transport
     * @return the classified message
     */
    DfxInboundMessage decode(byte[] message);
}
