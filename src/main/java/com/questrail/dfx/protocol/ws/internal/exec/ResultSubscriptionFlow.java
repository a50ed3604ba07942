package com.questrail.dfx.protocol.ws.internal.exec;

import com.questrail.dfx.protocol.ws.codec.DfxFrameEncoder;
import com.questrail.dfx.protocol.ws.codec.impl.RequestIdGenerator;
import com.questrail.dfx.protocol.ws.codec.impl.DfxFraming;
import com.questrail.dfx.protocol.ws.internal.body.ProtobufRequestBodies;
import com.questrail.dfx.protocol.ws.internal.frame.DfxInboundMessage;
import com.questrail.dfx.protocol.ws.internal.frame.DfxRequestFrame;
import com.questrail.dfx.protocol.ws.internal.route.ResponseRouter;
import com.questrail.dfx.protocol.ws.observability.DfxObservabilitySink;
import com.questrail.dfx.protocol.ws.observability.DfxProtocolObservabilityEvent;
import com.questrail.dfx.protocol.ws.transport.DfxSocketTransport;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.LockSupport;

/**
 * ResultSubscriptionFlow
 * =============================================================================
 * Subscribes to one measurement's results and drains result chunks into a sink
 * until the allocated quota is delivered or the caller cancels.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>{@code allocate = cursor.allocate()}; fails with
 *       {@link InvalidQuotaException} before anything is sent.</li>
 *   <li>Send exactly one {@code 0510} frame under a fresh request id.</li>
 *   <li>Loop until {@code allocate} chunks are delivered: check cancellation
 *       and interruption, try one receive and ingest it, then pop a subscribe status. A non-200
 *       status fails the call with {@link SubscriptionRejectedException}. If no
 *       status was popped, pop one result chunk and deliver its payload.</li>
 * </ol>
 *
 * <p>There is no local timeout. The server ends a measurement by closing it,
 * which surfaces as a status.</p>
 *
 * <p>Cancellation or an interrupt of the calling thread returns
 * {@code (true, delivered)}, leaving the interrupt status set; otherwise the call returns
 * {@code (cursor.chunksRemaining() == 0, delivered)}. A {@code false} result
 * means the recording continues in another measurement.</p>
 */
public final class ResultSubscriptionFlow
{
    /** Result payloads shorter than this usually carry a worker error message. */
    static final int SHORT_RESULT_BYTES = 1000;

    private static final long IDLE_PARK_NANOS = 1_000_000L;

    private final DfxSocketTransport transport;
    private final ResponseRouter router;
    private final DfxFrameEncoder encoder;
    private final RequestIdGenerator requestIds;
    private final Duration receiveWait;
    private final DfxObservabilitySink observability;

    public ResultSubscriptionFlow(DfxSocketTransport transport,
                                  ResponseRouter router,
                                  DfxFrameEncoder encoder,
                                  RequestIdGenerator requestIds,
                                  Duration receiveWait,
                                  DfxObservabilitySink observability)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.router = Objects.requireNonNull(router, "router");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
        this.receiveWait = Objects.requireNonNull(receiveWait, "receiveWait");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    /**
     * @param measurementId measurement to subscribe to
     * @param startingChunkIndex index reported with the first delivered chunk
     * @param sink receives each result payload
     * @param cursor recording quota; decremented by this call's allocation
     * @param cancellation cooperative stop flag
     */
    public SubscriptionResult subscribe(String measurementId,
                                        int startingChunkIndex,
                                        ResultChunkSink sink,
                                        MeasurementCursor cursor,
                                        CancellationToken cancellation)
    {
        Objects.requireNonNull(measurementId, "measurementId");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cursor, "cursor");
        Objects.requireNonNull(cancellation, "cancellation");

        final int allocated = cursor.allocate();

        String requestId = requestIds.nextId();
        byte[] body = ProtobufRequestBodies.subscribeResultsRequest(measurementId, requestId);
        transport.send(encoder.encode(new DfxRequestFrame(DfxFraming.ACTION_SUBSCRIBE_RESULTS, requestId, body)));

        int delivered = 0;
        while (delivered < allocated) {
            if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                return new SubscriptionResult(true, delivered);
            }

            Optional<byte[]> received = transport.tryReceiveOnce(receiveWait);
            received.ifPresent(message -> router.ingest(message, transport.connectionId()));

            Optional<DfxInboundMessage> status = router.popSubscribeStatus();
            if (status.isPresent()) {
                DfxInboundMessage s = status.get();
                if (s.statusCode() != 200) {
                    throw new SubscriptionRejectedException(measurementId, s.statusCode(), s.statusText());
                }
            }
            else {
                Optional<DfxInboundMessage> chunk = router.popResultChunk();
                if (chunk.isPresent()) {
                    byte[] payload = chunk.get().payload();
                    if (payload.length < SHORT_RESULT_BYTES) {
                        observability.onProtocolEvent(new DfxProtocolObservabilityEvent(
                                Instant.now(),
                                DfxProtocolObservabilityEvent.Kind.SHORT_RESULT_CHUNK,
                                measurementId,
                                new String(payload, StandardCharsets.UTF_8)));
                    }
                    sink.onResultChunk(startingChunkIndex + delivered, payload);
                    delivered++;
                    continue;
                }
            }

            if (received.isEmpty()) {
                LockSupport.parkNanos(IDLE_PARK_NANOS);
            }
        }

        return new SubscriptionResult(cursor.chunksRemaining() == 0, delivered);
    }
}
