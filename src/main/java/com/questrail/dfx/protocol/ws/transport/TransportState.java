package com.questrail.dfx.protocol.ws.transport;

/**
 * Lifecycle of a {@link DfxSocketTransport}. Transitions only move forward:
 * {@code DISCONNECTED -> CONNECTING -> CONNECTED -> CLOSED}; a failed connect
 * goes straight to {@code CLOSED}.
 */
public enum TransportState
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSED
}
