package com.questrail.dfx.protocol.ws.observability;

/**
 * No-op implementation of DfxObservabilitySink.
 */
public final class NullObservabilitySink implements DfxObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(DfxTransportObservabilityEvent event) {}

    @Override
    public void onProtocolEvent(DfxProtocolObservabilityEvent event) {}

    @Override
    public void onError(DfxErrorEvent event) {}
}
