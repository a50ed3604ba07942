package com.questrail.dfx.protocol.ws.observability;

import java.time.Instant;

/**
 * Record representing a protocol-level observation.
 */
public record DfxProtocolObservabilityEvent(
    Instant timestamp,
    Kind kind,
    String measurementId,
    String detail
) {
    public enum Kind {
        UNRECOGNIZED_SENDER,
        SHORT_RESULT_CHUNK,
        ACK_TIMEOUT,
        MEASUREMENT_ROTATED
    }
}
