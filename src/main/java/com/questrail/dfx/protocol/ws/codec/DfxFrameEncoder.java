package com.questrail.dfx.protocol.ws.codec;

import com.questrail.dfx.protocol.ws.internal.frame.DfxRequestFrame;

/**
 * DfxFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for outbound DFX WebSocket requests.
 *
 * <p>This interface defines the outbound boundary between a structured
 * {@link DfxRequestFrame} and the bytes written to the socket.</p>
 *
 * <p>The encoder is responsible only for:</p>
 * <ul>
 *   <li>Fixed-width rendering of the action code (4) and request id (10)</li>
 *   <li>Concatenating the already-serialized body</li>
 * </ul>
 *
 * <p>The encoder is <strong>not</strong> responsible for producing the body.
 * Body serialization happens before a frame is constructed, and any failure
 * there propagates to the caller untouched.</p>
 */
public interface DfxFrameEncoder
{
    /**
     * Encode a request frame into its exact wire representation.
     *
     * @param frame request to encode
     * @return {@code [action:4][requestId:10][body]}
     */
    byte[] encode(DfxRequestFrame frame);
}
