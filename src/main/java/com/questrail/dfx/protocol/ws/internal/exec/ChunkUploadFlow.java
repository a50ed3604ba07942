package com.questrail.dfx.protocol.ws.internal.exec;

import com.questrail.dfx.model.DfxErrorCode;
import com.questrail.dfx.protocol.ws.codec.DfxFrameEncoder;
import com.questrail.dfx.protocol.ws.codec.impl.RequestIdGenerator;
import com.questrail.dfx.protocol.ws.codec.impl.DfxFraming;
import com.questrail.dfx.protocol.ws.internal.body.ProtobufRequestBodies;
import com.questrail.dfx.protocol.ws.internal.frame.DfxInboundMessage;
import com.questrail.dfx.protocol.ws.internal.frame.DfxRequestFrame;
import com.questrail.dfx.protocol.ws.internal.route.ResponseRouter;
import com.questrail.dfx.protocol.ws.internal.time.MonotonicClock;
import com.questrail.dfx.protocol.ws.observability.DfxObservabilitySink;
import com.questrail.dfx.protocol.ws.observability.DfxProtocolObservabilityEvent;
import com.questrail.dfx.protocol.ws.transport.DfxSocketTransport;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.LockSupport;

/**
 * ChunkUploadFlow
 * =============================================================================
 * Sends one payload chunk over the WebSocket and waits for its add-data
 * acknowledgement.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Encode and send exactly one {@code 0506} frame.</li>
 *   <li>Loop: check cancellation and interruption, try one receive, ingest it
 *       into the router, pop the oldest add-data status.</li>
 *   <li>Stop when a status arrives, when cancelled or interrupted, or when
 *       {@code timeout} has elapsed since the last message was received.</li>
 * </ol>
 *
 * <p>Every frame gets a fresh request id. Replies are matched against the
 * transport's connection id, which the server uses as their sender prefix.</p>
 *
 * <p>An interrupted caller gets {@link AckOutcome.Kind#ABORTED}; the interrupt
 * status is left set.</p>
 *
 * <p>Empty receives are never errors. Transport failures propagate. The flow
 * does not act on the status; measurement rotation belongs to the caller.</p>
 */
public final class ChunkUploadFlow
{
    /** Back-off when another caller holds the receive guard. */
    private static final long IDLE_PARK_NANOS = 1_000_000L;

    private final DfxSocketTransport transport;
    private final ResponseRouter router;
    private final DfxFrameEncoder encoder;
    private final RequestIdGenerator requestIds;
    private final MonotonicClock clock;
    private final Duration receiveWait;
    private final DfxObservabilitySink observability;

    public ChunkUploadFlow(DfxSocketTransport transport,
                           ResponseRouter router,
                           DfxFrameEncoder encoder,
                           RequestIdGenerator requestIds,
                           MonotonicClock clock,
                           Duration receiveWait,
                           DfxObservabilitySink observability)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.router = Objects.requireNonNull(router, "router");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.receiveWait = Objects.requireNonNull(receiveWait, "receiveWait");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    /**
     * Upload one chunk and wait for the acknowledgement.
     *
     * @return the outcome; never {@code null}
     * @throws com.questrail.dfx.protocol.ws.transport.DfxTransportException on socket failure
     * @throws com.questrail.dfx.protocol.ws.internal.body.RequestBodyException if the body cannot be serialized
     */
    public AckOutcome uploadChunk(String measurementId,
                                  int chunkOrder,
                                  String action,
                                  double startTime,
                                  double endTime,
                                  double duration,
                                  byte[] payload,
                                  Map<String, Object> meta,
                                  Duration timeout,
                                  CancellationToken cancellation)
    {
        Objects.requireNonNull(measurementId, "measurementId");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(cancellation, "cancellation");

        byte[] body = ProtobufRequestBodies.dataRequest(
                measurementId, chunkOrder, action, startTime, endTime, duration, payload, meta);
        DfxRequestFrame frame = new DfxRequestFrame(DfxFraming.ACTION_ADD_DATA, requestIds.nextId(), body);

        transport.send(encoder.encode(frame));

        final long timeoutNanos = timeout.toNanos();
        long deadline = clock.nowNanos() + timeoutNanos;

        while (true) {
            if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                return AckOutcome.aborted();
            }

            Optional<byte[]> received = transport.tryReceiveOnce(receiveWait);
            if (received.isPresent()) {
                router.ingest(received.get(), transport.connectionId());
                deadline = clock.nowNanos() + timeoutNanos;
            }

            Optional<DfxInboundMessage> ack = router.popAddDataStatus();
            if (ack.isPresent()) {
                return toOutcome(ack.get());
            }

            if (clock.nowNanos() - deadline >= 0) {
                observability.onProtocolEvent(new DfxProtocolObservabilityEvent(
                        Instant.now(),
                        DfxProtocolObservabilityEvent.Kind.ACK_TIMEOUT,
                        measurementId,
                        "chunk " + chunkOrder + " unacknowledged after " + timeout));
                return AckOutcome.timedOut();
            }

            if (received.isEmpty()) {
                LockSupport.parkNanos(IDLE_PARK_NANOS);
            }
        }
    }

    private static AckOutcome toOutcome(DfxInboundMessage ack)
    {
        int status = ack.statusCode();
        String text = ack.text();
        if (status == 200) {
            return new AckOutcome(AckOutcome.Kind.SUCCESS, status, text, ack.raw(), DfxErrorCode.NONE);
        }
        return new AckOutcome(AckOutcome.Kind.REJECTED, status, text, ack.raw(), DfxErrorCode.parse(text));
    }
}
