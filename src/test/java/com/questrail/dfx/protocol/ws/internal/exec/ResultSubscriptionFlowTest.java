package com.questrail.dfx.protocol.ws.internal.exec;

import com.questrail.dfx.protocol.ws.codec.impl.DefaultDfxFrameDecoder;
import com.questrail.dfx.protocol.ws.codec.impl.DefaultDfxFrameEncoder;
import com.questrail.dfx.protocol.ws.codec.impl.DfxFraming;
import com.questrail.dfx.protocol.ws.codec.impl.RequestIdGenerator;
import com.questrail.dfx.protocol.ws.internal.frame.DfxRequestFrame;
import com.questrail.dfx.protocol.ws.internal.route.ResponseRouter;
import com.questrail.dfx.protocol.ws.observability.DfxProtocolObservabilityEvent;
import com.questrail.dfx.protocol.ws.observability.RecordingObservabilitySink;
import com.questrail.dfx.protocol.ws.transport.DfxSocketTransport;
import com.questrail.dfx.protocol.ws.transport.FakeMessageEndpoint;
import com.questrail.dfx.protocol.ws.transport.InboundMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResultSubscriptionFlowTest
{
    private static final String SELF = "self000001";

    private FakeMessageEndpoint endpoint;
    private ResultSubscriptionFlow flow;
    private RecordingObservabilitySink sink;
    private final List<Integer> indexes = new ArrayList<>();
    private final List<byte[]> payloads = new ArrayList<>();
    private final ResultChunkSink resultSink = (index, payload) -> {
        indexes.add(index);
        payloads.add(payload);
    };

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        endpoint = new FakeMessageEndpoint();
        DfxSocketTransport transport = new DfxSocketTransport(endpoint, sink, SELF, 64);
        transport.connect(Duration.ofSeconds(1));
        flow = new ResultSubscriptionFlow(transport, new ResponseRouter(new DefaultDfxFrameDecoder()),
                new DefaultDfxFrameEncoder(), sequentialIds(), Duration.ofMillis(1), sink);
    }

    private static RequestIdGenerator sequentialIds() {
        AtomicInteger next = new AtomicInteger();
        return () -> String.format("sub%07d", next.incrementAndGet());
    }

    /** Server that accepts every subscription and streams {@code n} results of 2000 bytes. */
    private void serverStreams(int n) {
        endpoint.setResponder(m -> {
            List<byte[]> replies = new ArrayList<>();
            replies.add(InboundMessages.subscribeStatus(SELF, "200"));
            for (int i = 0; i < n; i++) {
                replies.add(InboundMessages.resultChunk(SELF, InboundMessages.payloadOf(2000, (byte) i)));
            }
            return replies;
        });
    }

    // ---------------------------------------------------------------------
    // Quota
    // ---------------------------------------------------------------------

    @Test
    void oneMinuteRecordingCompletesInOneSubscription() {
        serverStreams(4);
        MeasurementCursor cursor = MeasurementCursor.forRecording(15, 60, 120);

        SubscriptionResult result = flow.subscribe("meas-1", 0, resultSink, cursor, new CancellationToken());

        assertTrue(result.done());
        assertEquals(4, result.chunksDelivered());
        assertEquals(0, cursor.chunksRemaining());
        assertEquals(List.of(0, 1, 2, 3), indexes);
        assertEquals(2000, payloads.get(0).length);
        assertEquals((byte) 3, payloads.get(3)[0]);
    }

    @Test
    void longRecordingDeliversOneMeasurementWorthAndIsNotDone() {
        serverStreams(8);
        MeasurementCursor cursor = new MeasurementCursor(20, 8);

        SubscriptionResult result = flow.subscribe("meas-1", 0, resultSink, cursor, new CancellationToken());

        assertFalse(result.done());
        assertEquals(8, result.chunksDelivered());
        assertEquals(12, cursor.chunksRemaining());
    }

    @Test
    void chunkIndexesContinueFromStartingIndex() {
        serverStreams(2);

        flow.subscribe("meas-2", 8, resultSink, new MeasurementCursor(2, 8), new CancellationToken());

        assertEquals(List.of(8, 9), indexes);
    }

    @Test
    void zeroRemainingReturnsDoneWithoutDeliveries() {
        SubscriptionResult result = flow.subscribe("meas-1", 0, resultSink, new MeasurementCursor(0, 8),
                new CancellationToken());

        assertTrue(result.done());
        assertEquals(0, result.chunksDelivered());
    }

    @Test
    void negativeQuotaFailsBeforeAnythingIsSent() {
        MeasurementCursor cursor = new MeasurementCursor(-1, 8);

        assertThrows(InvalidQuotaException.class,
                () -> flow.subscribe("meas-1", 0, resultSink, cursor, new CancellationToken()));
        assertTrue(endpoint.sent().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Status handling
    // ---------------------------------------------------------------------

    @Test
    void rejectedSubscriptionFailsImmediately() {
        endpoint.setResponder(m -> List.of(InboundMessages.subscribeStatus("XXXXXXXXXX", "404")));

        SubscriptionRejectedException e = assertThrows(SubscriptionRejectedException.class,
                () -> flow.subscribe("bad-id", 0, resultSink, new MeasurementCursor(4, 8), new CancellationToken()));

        assertEquals(404, e.statusCode());
        assertEquals("bad-id", e.measurementId());
        assertTrue(indexes.isEmpty());
    }

    @Test
    void rejectionIsAHardStopEvenWhenCancelledLater() {
        endpoint.setResponder(m -> List.of(InboundMessages.subscribeStatus(SELF, "403")));

        assertThrows(SubscriptionRejectedException.class,
                () -> flow.subscribe("meas-1", 0, resultSink, new MeasurementCursor(4, 8), new CancellationToken()));
    }

    @Test
    void sendsOneSubscribeFrameUnderAFreshRequestId() {
        serverStreams(1);

        flow.subscribe("meas-1", 0, resultSink, new MeasurementCursor(1, 8), new CancellationToken());
        flow.subscribe("meas-1", 1, resultSink, new MeasurementCursor(1, 8), new CancellationToken());

        assertEquals(2, endpoint.sent().size());
        DfxRequestFrame first = DfxFraming.splitRequest(endpoint.sent().get(0));
        DfxRequestFrame second = DfxFraming.splitRequest(endpoint.sent().get(1));
        assertEquals(DfxFraming.ACTION_SUBSCRIBE_RESULTS, first.actionCode());
        assertEquals("sub0000001", first.requestId());
        assertEquals("sub0000002", second.requestId());
    }

    @Test
    void interruptedCallerStopsWithPartialProgress() {
        endpoint.setResponder(m -> List.of(InboundMessages.subscribeStatus(SELF, "200")));
        MeasurementCursor cursor = new MeasurementCursor(4, 8);

        Thread.currentThread().interrupt();
        SubscriptionResult result;
        try {
            result = flow.subscribe("meas-1", 0, resultSink, cursor, new CancellationToken());
        }
        finally {
            assertTrue(Thread.interrupted(), "interrupt status must be preserved");
        }

        assertTrue(result.done());
        assertEquals(0, result.chunksDelivered());
        assertTrue(payloads.isEmpty());
        assertEquals(1, endpoint.sent().size());
    }

    @Test
    void shortResultIsDeliveredAndReported() {
        endpoint.setResponder(m -> List.of(
                InboundMessages.subscribeStatus(SELF, "200"),
                InboundMessages.resultChunk(SELF,
                        "{\"Error\":\"worker error: no face detected in the submitted chunk\"}".getBytes(StandardCharsets.UTF_8))));

        flow.subscribe("meas-1", 0, resultSink, new MeasurementCursor(1, 8), new CancellationToken());

        assertEquals(1, payloads.size());
        List<DfxProtocolObservabilityEvent> events =
                sink.protocolEvents(DfxProtocolObservabilityEvent.Kind.SHORT_RESULT_CHUNK);
        assertEquals(1, events.size());
        assertTrue(events.get(0).detail().contains("no face detected"));
    }

    // ---------------------------------------------------------------------
    // Cancellation
    // ---------------------------------------------------------------------

    @Test
    void cancellationReturnsPartialProgressAsDone() throws Exception {
        serverStreams(2);
        CancellationToken cancel = new CancellationToken();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(20);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            cancel.cancel();
        });
        canceller.start();

        SubscriptionResult result = flow.subscribe("meas-1", 0, resultSink, new MeasurementCursor(8, 8), cancel);
        canceller.join();

        assertTrue(result.done());
        assertEquals(2, result.chunksDelivered());
    }
}
