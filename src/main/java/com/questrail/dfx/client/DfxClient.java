package com.questrail.dfx.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.dfx.config.AddDataMethod;
import com.questrail.dfx.config.DfxClientConfig;
import com.questrail.dfx.config.DfxTimingPolicy;
import com.questrail.dfx.model.ChunkAction;
import com.questrail.dfx.model.MeasurementChunk;
import com.questrail.dfx.protocol.ws.codec.impl.DefaultDfxFrameDecoder;
import com.questrail.dfx.protocol.ws.codec.impl.DefaultDfxFrameEncoder;
import com.questrail.dfx.protocol.ws.codec.impl.RequestIdGenerator;
import com.questrail.dfx.protocol.ws.internal.exec.AckOutcome;
import com.questrail.dfx.protocol.ws.internal.exec.CancellationToken;
import com.questrail.dfx.protocol.ws.internal.exec.ChunkUploadFlow;
import com.questrail.dfx.protocol.ws.internal.exec.MeasurementCursor;
import com.questrail.dfx.protocol.ws.internal.exec.ResultChunkSink;
import com.questrail.dfx.protocol.ws.internal.exec.ResultSubscriptionFlow;
import com.questrail.dfx.protocol.ws.internal.exec.SubscriptionResult;
import com.questrail.dfx.protocol.ws.internal.route.ResponseRouter;
import com.questrail.dfx.protocol.ws.internal.time.MonotonicClock;
import com.questrail.dfx.protocol.ws.internal.time.SystemMonotonicClock;
import com.questrail.dfx.protocol.ws.observability.DfxObservabilitySink;
import com.questrail.dfx.protocol.ws.observability.DfxProtocolObservabilityEvent;
import com.questrail.dfx.protocol.ws.transport.DfxSocketTransport;
import com.questrail.dfx.protocol.ws.transport.DfxTransportException;
import com.questrail.dfx.protocol.ws.transport.MessageEndpointFactory;
import com.questrail.dfx.protocol.ws.transport.TransportState;
import com.questrail.dfx.protocol.ws.transport.netty.NettyWebSocketEndpoint;
import com.questrail.dfx.rest.DfxApiException;
import com.questrail.dfx.rest.DfxRestClient;
import com.questrail.dfx.rest.DfxRestResponse;
import com.questrail.dfx.rest.MeasurementsApi;
import com.questrail.dfx.rest.OrganizationsApi;
import com.questrail.dfx.rest.UsersApi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * DfxClient
 * =============================================================================
 * Entry point of the SDK: authenticates, creates measurements, uploads chunks
 * and streams results.
 *
 * <h2>Typical use</h2>
 * <pre>
 *   DfxClient client = DfxClient.builder(config).build();   // authenticates
 *   client.createNewMeasurement();
 *   // thread A
 *   client.subscribeToResults((index, payload) -> ...);
 *   // thread B
 *   for (MeasurementChunk c : chunks) client.addChunk(c);
 * </pre>
 *
 * <h2>Measurement rotation</h2>
 * <p>The server caps the length of one measurement. When an upload is refused
 * with {@code MEASUREMENT_CLOSED}, the uploader waits for the subscriber to
 * finish its current cycle, retrieves the closed measurement's results,
 * creates a new measurement and re-sends the refused chunk there. The
 * subscriber, seeing {@code done == false}, waits for the new measurement id
 * and subscribes to it.</p>
 *
 * <h2>Shutdown</h2>
 * <p>The WebSocket is closed once both uploading and subscribing are done, or
 * on {@link #shutdown()}.</p>
 */
public final class DfxClient implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(DfxClient.class);

    private final DfxClientConfig config;
    private final DfxTimingPolicy timing;
    private final DfxObservabilitySink observability;
    private final DfxAuthenticator authenticator;
    private final MeasurementsApi measurements;
    private final MessageEndpointFactory endpointFactory;
    private final MonotonicClock clock;
    private final RequestIdGenerator connectionIds;
    private final RequestIdGenerator requestIds;

    private final MeasurementCursor cursor;
    private final int numChunks;
    private final CancellationToken cancellation = new CancellationToken();

    private final Object monitor = new Object();
    private String measurementId;
    private boolean subscriptionCycleComplete = true;
    private boolean addDataDone = true;
    private boolean subscribeDone = true;
    private boolean complete;

    private DfxSocketTransport transport;
    private ChunkUploadFlow uploadFlow;
    private ResultSubscriptionFlow subscriptionFlow;

    private DfxClient(Builder builder)
    {
        this.config = builder.config;
        this.timing = config.timingPolicy();
        this.observability = config.observability();
        this.endpointFactory = builder.endpointFactory;
        this.clock = builder.clock;
        this.connectionIds = builder.connectionIds;
        this.requestIds = builder.requestIds;

        DfxRestClient rest = builder.restClient != null
                ? builder.restClient
                : new DfxRestClient(config.endpoints().restUrl());
        this.measurements = new MeasurementsApi(rest);
        this.authenticator = new DfxAuthenticator(
                config.endpoints().serverId(),
                config.licenseKey(),
                config.deviceName(),
                config.user(),
                config.credentialStore(),
                new OrganizationsApi(rest, config.licenseKey()),
                new UsersApi(rest));

        this.cursor = MeasurementCursor.forRecording(
                config.chunkDurationSeconds(),
                config.recordingLengthSeconds(),
                config.measurementMode().maxMeasurementLength().toSeconds());
        this.numChunks = cursor.chunksRemaining();
    }

    public static Builder builder(DfxClientConfig config)
    {
        return new Builder(config);
    }

    // -------------------------------------------------------------------------
    // Measurements
    // -------------------------------------------------------------------------

    /**
     * Create a measurement and make it current. An invalid user token is
     * refreshed once and the call retried.
     *
     * @return the new measurement id
     */
    public String createNewMeasurement()
    {
        String id;
        try {
            id = createMeasurement(authenticator.userToken());
        }
        catch (DfxApiException e) {
            if (!e.isInvalidToken()) {
                throw e;
            }
            log.warn("User token rejected while creating a measurement; logging in again");
            id = createMeasurement(authenticator.refreshUserToken());
        }

        synchronized (monitor) {
            measurementId = id;
            monitor.notifyAll();
        }
        log.info("Created measurement {}", id);
        return id;
    }

    private String createMeasurement(String token)
    {
        return measurements.create(token, config.studyId(), config.userProfileId(), config.measurementMode().name());
    }

    public String measurementId()
    {
        synchronized (monitor) {
            return measurementId;
        }
    }

    /**
     * Retrieve the current measurement and its results.
     */
    public JsonNode retrieveResults()
    {
        return retrieveResults(requireMeasurementId());
    }

    public JsonNode retrieveResults(String measurementId)
    {
        return measurements.retrieve(authenticator.userToken(), measurementId);
    }

    // -------------------------------------------------------------------------
    // Upload
    // -------------------------------------------------------------------------

    /**
     * Upload one chunk to the current measurement, rotating to a new
     * measurement if the server reports the current one closed.
     *
     * <p>When pacing is enabled the call returns after the chunk's duration,
     * keeping uploads at recording speed.</p>
     */
    public void addChunk(MeasurementChunk chunk)
    {
        Objects.requireNonNull(chunk, "chunk");
        String mid = requireMeasurementId();

        ChunkAction action = ChunkAction.forOrder(chunk.chunkOrder(), numChunks);
        synchronized (monitor) {
            addDataDone = false;
        }

        try {
            AckOutcome outcome = upload(mid, chunk, action);
            if (!outcome.isSuccess()) {
                if (outcome.isMeasurementClosed()) {
                    rotateAndResend(chunk, action);
                }
                else {
                    log.warn("Chunk {} of measurement {} not accepted: {} {}",
                            chunk.chunkOrder(), mid, outcome.kind(), outcome.status());
                    markAddDataDone();
                }
            }
        }
        catch (DfxTransportException e) {
            markAddDataDone();
            if (!cancellation.isCancelled()) {
                throw e;
            }
            log.debug("Upload interrupted by shutdown", e);
        }
        if (action == ChunkAction.LAST) {
            markAddDataDone();
        }

        if (timing.paceUploads()) {
            pause(Duration.ofMillis((long) (chunk.duration() * 1000)));
        }
        handleExit();
    }

    private AckOutcome upload(String mid, MeasurementChunk chunk, ChunkAction action)
    {
        if (config.addDataMethod() == AddDataMethod.WEBSOCKET) {
            ChunkUploadFlow flow = ensureConnected().uploadFlow;
            return flow.uploadChunk(mid,
                    chunk.chunkOrder(),
                    action.wireValue(),
                    chunk.startTime(),
                    chunk.endTime(),
                    chunk.duration(),
                    chunk.payload(),
                    chunk.meta(),
                    timing.ackTimeout(),
                    cancellation);
        }

        DfxRestResponse response = measurements.addData(authenticator.userToken(),
                mid,
                chunk.chunkOrder(),
                action.wireValue(),
                chunk.startTime(),
                chunk.endTime(),
                chunk.duration(),
                chunk.payload(),
                chunk.meta());
        AckOutcome.Kind kind = response.status() == 200 ? AckOutcome.Kind.SUCCESS : AckOutcome.Kind.REJECTED;
        return new AckOutcome(kind, response.status(), response.rawBody(),
                response.rawBody().getBytes(StandardCharsets.UTF_8), response.errorCode());
    }

    private void rotateAndResend(MeasurementChunk chunk, ChunkAction action)
    {
        String closed = measurementId();
        log.info("Measurement {} closed by server; rotating", closed);

        // Results of the closed measurement must all be in before it is replaced.
        synchronized (monitor) {
            while (!subscriptionCycleComplete && !cancellation.isCancelled()) {
                awaitMonitor();
            }
        }
        if (cancellation.isCancelled()) {
            return;
        }

        retrieveResults(closed);
        String next = createNewMeasurement();
        observability.onProtocolEvent(new DfxProtocolObservabilityEvent(
                Instant.now(),
                DfxProtocolObservabilityEvent.Kind.MEASUREMENT_ROTATED,
                next,
                "replaces " + closed));
        pause(timing.rotationSignalDelay());

        AckOutcome resent = upload(next, chunk, action);
        if (!resent.isSuccess()) {
            log.warn("Chunk {} re-sent to measurement {} not accepted: {} {}",
                    chunk.chunkOrder(), next, resent.kind(), resent.status());
        }
    }

    private void markAddDataDone()
    {
        synchronized (monitor) {
            addDataDone = true;
            monitor.notifyAll();
        }
    }

    // -------------------------------------------------------------------------
    // Subscribe
    // -------------------------------------------------------------------------

    /**
     * Stream every result of the recording into {@code sink}, following
     * measurement rotations. Blocks until all results are delivered or the
     * client is shut down.
     *
     * @return number of results delivered
     */
    public int subscribeToResults(ResultChunkSink sink)
    {
        Objects.requireNonNull(sink, "sink");
        String mid = requireMeasurementId();
        ResultSubscriptionFlow flow = ensureConnected().subscriptionFlow;

        synchronized (monitor) {
            subscribeDone = false;
            subscriptionCycleComplete = false;
            complete = false;
        }

        int delivered = 0;
        try {
            while (true) {
                SubscriptionResult result = flow.subscribe(mid, delivered, sink, cursor, cancellation);
                delivered += result.chunksDelivered();
                if (result.done()) {
                    break;
                }

                synchronized (monitor) {
                    subscriptionCycleComplete = true;
                    monitor.notifyAll();
                    while (mid.equals(measurementId) && !addDataDone && !cancellation.isCancelled()) {
                        awaitMonitor();
                    }
                    if (mid.equals(measurementId)) {
                        // Uploads ended without opening another measurement.
                        break;
                    }
                    mid = measurementId;
                    subscriptionCycleComplete = false;
                }
                log.info("Subscription continuing on measurement {}", mid);
                pause(timing.rotationSignalDelay());
            }
        }
        catch (DfxTransportException e) {
            if (!cancellation.isCancelled()) {
                throw e;
            }
            log.debug("Subscription interrupted by shutdown", e);
        }
        finally {
            synchronized (monitor) {
                subscriptionCycleComplete = true;
                subscribeDone = true;
                monitor.notifyAll();
            }
        }

        handleExit();
        return delivered;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Forget all cached credentials.
     */
    public void clearCredentials()
    {
        config.credentialStore().clear();
    }

    /**
     * Stop uploads and subscriptions and close the WebSocket. Running calls
     * return their partial progress.
     */
    public void shutdown()
    {
        cancellation.cancel();
        synchronized (monitor) {
            addDataDone = true;
            monitor.notifyAll();
        }
        closeTransport();
    }

    @Override
    public void close()
    {
        shutdown();
    }

    private void handleExit()
    {
        synchronized (monitor) {
            if (complete || !addDataDone || !subscribeDone) {
                return;
            }
            complete = true;
        }
        log.info("Uploads and subscription finished");
        closeTransport();
    }

    private synchronized DfxClient ensureConnected()
    {
        if (transport == null || transport.state() == TransportState.CLOSED) {
            if (cancellation.isCancelled()) {
                throw new DfxTransportException("Client is shut down");
            }
            if (transport != null) {
                transport.close();
            }
            DfxSocketTransport t = new DfxSocketTransport(
                    endpointFactory.create(config.endpoints().webSocketUri(), authenticator.userToken()),
                    observability,
                    connectionIds.nextId(),
                    DfxSocketTransport.DEFAULT_INBOUND_CAPACITY);
            t.connect(timing.connectTimeout());

            ResponseRouter router = new ResponseRouter(new DefaultDfxFrameDecoder(), observability,
                    ResponseRouter.DEFAULT_UNRECOGNIZED_CAPACITY);
            DefaultDfxFrameEncoder encoder = new DefaultDfxFrameEncoder();
            this.uploadFlow = new ChunkUploadFlow(t, router, encoder, requestIds, clock,
                    timing.receivePollInterval(), observability);
            this.subscriptionFlow = new ResultSubscriptionFlow(t, router, encoder, requestIds,
                    timing.receivePollInterval(), observability);
            this.transport = t;
            log.info("Connected to {}", config.endpoints().webSocketUri());
        }
        return this;
    }

    private synchronized void closeTransport()
    {
        if (transport != null) {
            transport.close();
        }
    }

    private String requireMeasurementId()
    {
        synchronized (monitor) {
            if (measurementId == null) {
                throw new IllegalStateException("No measurement; call createNewMeasurement() first");
            }
            return measurementId;
        }
    }

    /** Caller holds {@link #monitor}. */
    private void awaitMonitor()
    {
        try {
            monitor.wait(Math.max(1, timing.receivePollInterval().toMillis()));
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
        }
    }

    private static void pause(Duration d)
    {
        if (d.isZero() || d.isNegative()) {
            return;
        }
        try {
            Thread.sleep(d.toMillis());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -------------------------------------------------------------------------

    public static final class Builder
    {
        private final DfxClientConfig config;
        private DfxRestClient restClient;
        private MessageEndpointFactory endpointFactory = NettyWebSocketEndpoint::new;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private RequestIdGenerator connectionIds = RequestIdGenerator.random();
        private RequestIdGenerator requestIds = RequestIdGenerator.random();

        private Builder(DfxClientConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withRestClient(DfxRestClient restClient)
        {
            this.restClient = restClient;
            return this;
        }

        public Builder withEndpointFactory(MessageEndpointFactory endpointFactory)
        {
            this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
            return this;
        }

        public Builder withClock(MonotonicClock clock)
        {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Source of the 10-character id minted for each WebSocket connection.
         */
        public Builder withConnectionIds(RequestIdGenerator connectionIds)
        {
            this.connectionIds = Objects.requireNonNull(connectionIds, "connectionIds");
            return this;
        }

        /**
         * Source of the 10-character id stamped on each outbound frame.
         */
        public Builder withRequestIds(RequestIdGenerator requestIds)
        {
            this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
            return this;
        }

        /**
         * Build the client and authenticate.
         *
         * @throws DfxAuthenticationException if authentication fails
         */
        public DfxClient build()
        {
            DfxClient client = new DfxClient(this);
            client.authenticator.authenticate();
            return client;
        }
    }
}
