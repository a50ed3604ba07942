package com.questrail.dfx.protocol.ws.transport;

/**
 * MessageEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a message-oriented duplex transport (one WebSocket).
 *
 * <p>The endpoint moves whole messages and reports lifecycle changes. It knows
 * nothing about DFX framing, classification, or flows. Higher layers
 * ({@link DfxSocketTransport}) own those concerns.</p>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface MessageEndpoint
{
    /**
     * Start connecting.
     *
     * <p>On success the endpoint MUST notify its listener via
     * {@link MessageEndpointListener#onTransportUp()} exactly once. On failure it
     * MUST call {@link MessageEndpointListener#onTransportDown(Throwable)} with
     * the cause.</p>
     */
    void start();

    /**
     * Close the connection and release all transport resources. Safe to call
     * more than once.
     */
    void stop();

    /**
     * Send one complete binary message.
     *
     * <p>Returns once the message has been written. Implementations MUST NOT
     * split or merge messages.</p>
     *
     * @param message full message bytes
     * @throws DfxTransportException if the connection is not open or the write fails
     */
    void send(byte[] message);

    /**
     * Register the listener that receives inbound messages and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(MessageEndpointListener listener);
}
