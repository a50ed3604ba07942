package com.questrail.dfx.protocol.ws.codec.impl;

import com.questrail.dfx.protocol.ws.internal.frame.DfxRequestFrame;
import com.questrail.dfx.protocol.ws.internal.frame.InboundKind;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * DfxFraming
 * -----------------------------------------------------------------------------
 * Single home of the DFX WebSocket wire constants and the length-based inbound
 * classification rule.
 *
 * <p>Per the DFX API WebSocket conventions:</p>
 * <ul>
 *   <li>Outbound requests start with a 4-character action code followed by a
 *       10-character request id.</li>
 *   <li>Inbound messages start with a 10-character sender id followed by a
 *       3-character status code.</li>
 *   <li>A 13-byte message is a subscribe status, 14 to 60 bytes is an add-data
 *       status, anything longer is a result chunk.</li>
 * </ul>
 *
 * <p>The thresholds are part of the wire contract. They must not be re-derived
 * at call sites and type must never be inferred from content.</p>
 */
public final class DfxFraming
{
    /** Width of the outbound action code field. */
    public static final int ACTION_CODE_WIDTH = 4;

    /** Width of the outbound request id field. */
    public static final int REQUEST_ID_WIDTH = 10;

    /** Width of the full outbound header. */
    public static final int REQUEST_HEADER_WIDTH = ACTION_CODE_WIDTH + REQUEST_ID_WIDTH;

    /** Exact length of a subscribe-status message. */
    public static final int SUBSCRIBE_STATUS_LENGTH = 13;

    /** Upper bound (inclusive) of an add-data status message. */
    public static final int ADD_DATA_STATUS_MAX_LENGTH = 60;

    /** Action code of the add-data endpoint (506). */
    public static final String ACTION_ADD_DATA = "0506";

    /** Action code of the subscribe-results endpoint (510). */
    public static final String ACTION_SUBSCRIBE_RESULTS = "0510";

    private DfxFraming() {}

    /**
     * Classifies an inbound message by its total length.
     *
     * <p>Total function: lengths 0..12 fall into {@link InboundKind#ADD_DATA_STATUS}
     * alongside 14..60, since the protocol has no shorter message shape and the
     * rule is "not 13 and not above 60".</p>
     *
     * @param message raw inbound bytes
     * @return exactly one classification
     */
    public static InboundKind classify(byte[] message)
    {
        Objects.requireNonNull(message, "message");
        return classifyLength(message.length);
    }

    /**
     * Length-only form of {@link #classify(byte[])}.
     */
    public static InboundKind classifyLength(int length)
    {
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0 (was " + length + ")");
        }
        if (length == SUBSCRIBE_STATUS_LENGTH) {
            return InboundKind.SUBSCRIBE_STATUS;
        }
        if (length <= ADD_DATA_STATUS_MAX_LENGTH) {
            return InboundKind.ADD_DATA_STATUS;
        }
        return InboundKind.RESULT_CHUNK;
    }

    /**
     * Renders {@code value} as exactly {@code width} ASCII bytes: longer values
     * are truncated, shorter values are right-padded with spaces.
     */
    static byte[] fixedWidth(String value, int width)
    {
        Objects.requireNonNull(value, "value");
        byte[] out = new byte[width];
        Arrays.fill(out, (byte) ' ');
        byte[] src = value.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(src, 0, out, 0, Math.min(src.length, width));
        return out;
    }

    /**
     * Splits an encoded request back into its three wire fields.
     *
     * <p>This is the wire-level inverse of {@link DefaultDfxFrameEncoder}. Fields
     * are returned exactly as they appear on the wire (padding is preserved).</p>
     *
     * @param encoded a complete encoded request
     * @return the recovered frame
     * @throws IllegalArgumentException if {@code encoded} is shorter than the header
     */
    public static DfxRequestFrame splitRequest(byte[] encoded)
    {
        Objects.requireNonNull(encoded, "encoded");
        if (encoded.length < REQUEST_HEADER_WIDTH) {
            throw new IllegalArgumentException(
                    "Encoded request shorter than " + REQUEST_HEADER_WIDTH + " byte header (was " + encoded.length + ")");
        }
        String action = new String(encoded, 0, ACTION_CODE_WIDTH, StandardCharsets.US_ASCII);
        String requestId = new String(encoded, ACTION_CODE_WIDTH, REQUEST_ID_WIDTH, StandardCharsets.US_ASCII);
        byte[] body = Arrays.copyOfRange(encoded, REQUEST_HEADER_WIDTH, encoded.length);
        return new DfxRequestFrame(action, requestId, body);
    }
}
