/**
 * DFX WebSocket Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the DFX WebSocket
 * sub-protocol. The wire rules are vendor-defined and fixed:</p>
 *
 * <pre>
 *   outbound: [ action code : 4 ][ request id : 10 ][ serialized body ]
 *   inbound : [ sender id   : 10 ][ remainder ]
 * </pre>
 *
 * <p>Inbound messages carry no type tag. They are classified purely by total
 * length (13 = subscribe status, 14..60 = add-data status, &gt; 60 = result chunk).
 * The thresholds are defined once in
 * {@link com.questrail.dfx.protocol.ws.codec.impl.DfxFraming} and every caller
 * goes through it.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] message
 *        → DfxFrameDecoder       (length classification)
 *            → DfxInboundMessage
 *                → ResponseRouter  (per-kind FIFO queues)
 * </pre>
 */
package com.questrail.dfx.protocol.ws.codec;
