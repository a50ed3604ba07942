package com.questrail.dfx.protocol.ws.observability;

/**
 * Main interface for receiving DFX WebSocket observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DfxObservabilitySink {
    /**
     * Called when the socket comes up or goes down.
     * @param event the transport event
     */
    void onTransportEvent(DfxTransportObservabilityEvent event);

    /**
     * Called for protocol-level observations (unrecognized sender, short result chunk,
     * measurement rotation, ack timeout).
     * @param event the protocol event
     */
    void onProtocolEvent(DfxProtocolObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs in the protocol stack.
     * @param event the error event
     */
    void onError(DfxErrorEvent event);
}
