package com.questrail.dfx.protocol.ws.observability;

import java.time.Instant;

/**
 * Record representing a transport lifecycle change.
 *
 * @param cause failure cause for {@code up == false}; {@code null} for orderly close
 */
public record DfxTransportObservabilityEvent(
    Instant timestamp,
    boolean up,
    Throwable cause
) {
}
