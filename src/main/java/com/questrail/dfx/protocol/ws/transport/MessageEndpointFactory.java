package com.questrail.dfx.protocol.ws.transport;

import java.net.URI;

/**
 * Creates the endpoint for one WebSocket session. The composition root picks
 * the implementation; tests substitute a fake.
 */
@FunctionalInterface
public interface MessageEndpointFactory
{
    /**
     * @param webSocketUri server address ({@code ws://} or {@code wss://})
     * @param bearerToken token sent in the handshake {@code Authorization} header
     */
    MessageEndpoint create(URI webSocketUri, String bearerToken);
}
