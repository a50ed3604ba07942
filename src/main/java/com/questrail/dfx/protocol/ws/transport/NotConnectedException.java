package com.questrail.dfx.protocol.ws.transport;

/**
 * Thrown when send or receive is attempted before the transport has connected.
 */
public final class NotConnectedException extends IllegalStateException
{
    private final TransportState state;

    public NotConnectedException(TransportState state)
    {
        super("Transport is not connected (state=" + state + ")");
        this.state = state;
    }

    public TransportState state()
    {
        return state;
    }
}
