package com.questrail.dfx.protocol.ws.internal.frame;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * DfxInboundMessage
 * -----------------------------------------------------------------------------
 * Immutable, classified view of one message received on the DFX WebSocket.
 *
 * <h2>Wire shape</h2>
 * <pre>
 *   [ sender / connection id : 10 ][ remainder ... ]
 * </pre>
 *
 * <p>For status messages the three bytes at offset 10 carry an ASCII status code
 * ({@code "200"} on success). For result chunks the first 13 bytes are a header
 * and everything after them is the result payload.</p>
 *
 * <p>No validation of body content happens here. The raw bytes are retained so
 * callers can report them verbatim.</p>
 */
public final class DfxInboundMessage
{
    /** Width of the sender / connection id prefix. */
    public static final int SENDER_ID_LENGTH = 10;

    /** Width of the full header (sender id + status code). */
    public static final int HEADER_LENGTH = 13;

    /** Status code reported when the status field is absent or not numeric. */
    public static final int UNPARSEABLE_STATUS = -1;

    private final byte[] raw;
    private final InboundKind kind;

    public DfxInboundMessage(byte[] raw, InboundKind kind) {
        Objects.requireNonNull(raw, "raw");
        this.raw = raw.clone();
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public InboundKind kind() {
        return kind;
    }

    /**
     * Returns a copy of the complete message as received.
     */
    public byte[] raw() {
        return raw.clone();
    }

    public int length() {
        return raw.length;
    }

    /**
     * Returns the leading sender id, decoded as UTF-8. Messages shorter than the
     * id width yield whatever prefix is present.
     */
    public String senderId() {
        int end = Math.min(SENDER_ID_LENGTH, raw.length);
        return new String(raw, 0, end, StandardCharsets.UTF_8);
    }

    /**
     * Returns the three status characters at offset 10, or an empty string if
     * the message is too short to carry them.
     */
    public String statusText() {
        if (raw.length < HEADER_LENGTH) {
            return "";
        }
        return new String(raw, SENDER_ID_LENGTH, HEADER_LENGTH - SENDER_ID_LENGTH, StandardCharsets.US_ASCII);
    }

    /**
     * Returns the status code at offset 10 parsed as an integer, or
     * {@link #UNPARSEABLE_STATUS} if the three bytes are not ASCII digits.
     */
    public int statusCode() {
        String text = statusText();
        if (text.length() != HEADER_LENGTH - SENDER_ID_LENGTH) {
            return UNPARSEABLE_STATUS;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return UNPARSEABLE_STATUS;
            }
        }
        return Integer.parseInt(text);
    }

    /**
     * Returns everything after the 13-byte header. For result chunks this is the
     * result payload handed to the caller's sink.
     */
    public byte[] payload() {
        if (raw.length <= HEADER_LENGTH) {
            return new byte[0];
        }
        return Arrays.copyOfRange(raw, HEADER_LENGTH, raw.length);
    }

    /**
     * Returns the whole message decoded as UTF-8 text. Used for error-code
     * detection on add-data acknowledgements.
     */
    public String text() {
        return new String(raw, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "DfxInboundMessage[" +
                "kind=" + kind +
                ", length=" + raw.length +
                ", status=" + statusText() +
                ']';
    }
}
