package com.questrail.dfx.protocol.ws.transport;

/**
 * MessageEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link MessageEndpoint}.
 *
 * <p>Callbacks are delivered serially. Netty endpoints deliver them on the
 * channel's event loop.</p>
 */
public interface MessageEndpointListener
{
    /**
     * Called when the connection (including any handshake) is usable.
     */
    void onTransportUp();

    /**
     * Called when the connection becomes unusable or fails to open.
     *
     * @param cause failure cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for each complete message received. The array is owned by the
     * listener.
     *
     * @param message raw message payload
     */
    void onMessage(byte[] message);
}
