package com.questrail.dfx.protocol.ws.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the DFX WebSocket stack.
 */
public record DfxErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
