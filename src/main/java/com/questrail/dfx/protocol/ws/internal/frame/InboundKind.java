package com.questrail.dfx.protocol.ws.internal.frame;

/**
 * Classification of an inbound WebSocket message.
 *
 * <p>The DFX WebSocket sub-protocol carries no type tag. The only discriminator
 * is the total message length (see {@code DfxFraming#classify(byte[])}):</p>
 * <ul>
 *   <li>{@link #SUBSCRIBE_STATUS}: exactly 13 bytes (sender id + 3-digit status)</li>
 *   <li>{@link #ADD_DATA_STATUS}: 14 to 60 bytes (status + short body)</li>
 *   <li>{@link #RESULT_CHUNK}: more than 60 bytes (13-byte header + result payload)</li>
 * </ul>
 */
public enum InboundKind
{
    SUBSCRIBE_STATUS,
    ADD_DATA_STATUS,
    RESULT_CHUNK
}
