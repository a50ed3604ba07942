package com.questrail.dfx.protocol.ws.internal.frame;

import java.util.Objects;

/**
 * DfxRequestFrame
 * -----------------------------------------------------------------------------
 * Immutable representation of one outbound DFX WebSocket request.
 *
 * <h2>Wire shape</h2>
 * <pre>
 *   [ action code : 4 ASCII ][ request id : 10 ASCII ][ serialized body ... ]
 * </pre>
 *
 * <p>This type holds the logical fields only. Fixed-width padding and truncation
 * are applied by the encoder, so {@code actionCode} and {@code requestId} are
 * kept exactly as supplied.</p>
 *
 * Immutability is enforced via defensive copying of the body.
 */
public final class DfxRequestFrame
{
    private final String actionCode;
    private final String requestId;
    private final byte[] body;

    public DfxRequestFrame(String actionCode, String requestId, byte[] body) {
        this.actionCode = Objects.requireNonNull(actionCode, "actionCode");
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.body = (body == null) ? new byte[0] : body.clone();
    }

    /**
     * Returns the endpoint action code (e.g. {@code "0506"} for add-data).
     */
    public String actionCode() {
        return actionCode;
    }

    /**
     * Returns the request id used to correlate this request.
     */
    public String requestId() {
        return requestId;
    }

    /**
     * Returns a copy of the serialized body bytes.
     */
    public byte[] body() {
        return body.clone();
    }

    @Override
    public String toString() {
        return "DfxRequestFrame[" +
                "action=" + actionCode +
                ", requestId=" + requestId +
                ", bodyLength=" + body.length +
                ']';
    }
}
