package com.questrail.dfx.protocol.ws.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DfxObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDfxObservabilitySink implements DfxObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDfxObservabilitySink.class);

    @Override
    public void onTransportEvent(DfxTransportObservabilityEvent event) {
        if (event.up()) {
            log.info("DFX WebSocket up");
        }
        else if (event.cause() == null) {
            log.info("DFX WebSocket closed");
        }
        else {
            log.warn("DFX WebSocket down: {}", event.cause().toString());
        }
    }

    @Override
    public void onProtocolEvent(DfxProtocolObservabilityEvent event) {
        switch (event.kind()) {
            case MEASUREMENT_ROTATED:
                log.info("Measurement rotated to {} ({})", event.measurementId(), event.detail());
                break;
            case ACK_TIMEOUT:
                log.warn("No add-data acknowledgement for measurement {}: {}", event.measurementId(), event.detail());
                break;
            default:
                log.debug("DFX Protocol Event: {}", event);
        }
    }

    @Override
    public void onError(DfxErrorEvent event) {
        log.error("DFX Error: {}", event.message(), event.cause());
    }
}
