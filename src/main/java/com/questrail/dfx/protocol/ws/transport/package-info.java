/**
 * DFX WebSocket Transport
 * =============================================================================
 *
 * <p>The {@link com.questrail.dfx.protocol.ws.transport.MessageEndpoint} port
 * moves whole messages. {@link com.questrail.dfx.protocol.ws.transport.DfxSocketTransport}
 * sits on top of it and provides the connection state machine, atomic sends and
 * the single-receive-in-flight guard the flows poll against.</p>
 *
 * <p>Framework types (Netty) stay inside the {@code netty} sub-package.</p>
 */
package com.questrail.dfx.protocol.ws.transport;
