package com.questrail.dfx.protocol.ws.transport;

import com.questrail.dfx.protocol.ws.codec.impl.RequestIdGenerator;
import com.questrail.dfx.protocol.ws.observability.DfxErrorEvent;
import com.questrail.dfx.protocol.ws.observability.DfxObservabilitySink;
import com.questrail.dfx.protocol.ws.observability.DfxTransportObservabilityEvent;
import com.questrail.dfx.protocol.ws.observability.NullObservabilitySink;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * DfxSocketTransport
 * =============================================================================
 * Owns one duplex WebSocket connection for its whole lifetime.
 *
 * <h2>Receive model</h2>
 * <p>The endpoint's I/O thread is the only reader of the socket. Every inbound
 * message is copied into a bounded FIFO owned by this class. Callers pull from
 * it with {@link #tryReceiveOnce(Duration)}.</p>
 *
 * <p>At most one receive is in flight at a time. The guard is a real lock:
 * a caller that finds it held gets {@link Optional#empty()} immediately and
 * is expected to poll again. A caller that acquires it waits up to the given
 * duration for the next message.</p>
 *
 * <h2>State machine</h2>
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED → CLOSED
 *                      └──────(failure)──────┘
 * </pre>
 * <p>{@link #send(byte[])} and {@link #tryReceiveOnce(Duration)} fail with
 * {@link NotConnectedException} before the connection is established, and with
 * {@link DfxTransportException} once it is closed. Messages that arrived before
 * a remote close are still handed out.</p>
 */
public final class DfxSocketTransport implements MessageEndpointListener, AutoCloseable
{
    public static final int DEFAULT_INBOUND_CAPACITY = 1024;

    private final MessageEndpoint endpoint;
    private final DfxObservabilitySink observability;
    private final String connectionId;

    private final BlockingQueue<byte[]> inbound;
    private final ReentrantLock receiveLock = new ReentrantLock();
    private final CountDownLatch connected = new CountDownLatch(1);

    private final Object stateLock = new Object();
    private volatile TransportState state = TransportState.DISCONNECTED;
    private volatile Throwable closeCause;
    private boolean endpointStopped;

    public DfxSocketTransport(MessageEndpoint endpoint)
    {
        this(endpoint, NullObservabilitySink.INSTANCE, RequestIdGenerator.random().nextId(), DEFAULT_INBOUND_CAPACITY);
    }

    public DfxSocketTransport(MessageEndpoint endpoint,
                              DfxObservabilitySink observability,
                              String connectionId,
                              int inboundCapacity)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        if (inboundCapacity < 1) {
            throw new IllegalArgumentException("inboundCapacity must be >= 1");
        }
        this.inbound = new LinkedBlockingQueue<>(inboundCapacity);
    }

    /**
     * Identifier of this connection, compared against the sender prefix of
     * inbound messages.
     */
    public String connectionId()
    {
        return connectionId;
    }

    public TransportState state()
    {
        return state;
    }

    /**
     * Open the connection and wait for it to become usable.
     *
     * @param timeout maximum time to wait for the handshake
     * @throws IllegalStateException if connect was already called
     * @throws DfxTransportException if the connection fails or times out
     */
    public void connect(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");

        synchronized (stateLock) {
            if (state != TransportState.DISCONNECTED) {
                throw new IllegalStateException("connect() called in state " + state);
            }
            state = TransportState.CONNECTING;
        }

        endpoint.setListener(this);
        endpoint.start();

        boolean signalled;
        try {
            signalled = connected.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failConnect(e);
            throw new DfxTransportException("Interrupted while connecting", e);
        }

        if (!signalled) {
            DfxTransportException timedOut = new DfxTransportException("Connect timed out after " + timeout);
            failConnect(timedOut);
            throw timedOut;
        }

        if (state != TransportState.CONNECTED) {
            stopEndpoint();
            throw new DfxTransportException("Connect failed", closeCause);
        }
    }

    /**
     * Write one complete frame.
     *
     * @throws NotConnectedException before {@link #connect(Duration)} succeeds
     * @throws DfxTransportException if the socket is closed or the write fails
     */
    public void send(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        requireOpen();
        try {
            endpoint.send(frame);
        }
        catch (DfxTransportException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new DfxTransportException("Send failed", e);
        }
    }

    /**
     * Attempt exactly one receive.
     *
     * @param wait how long to wait for a message once the receive guard is held
     * @return the next message, or empty if another receive is in flight or
     *         nothing arrived within {@code wait}
     * @throws NotConnectedException before {@link #connect(Duration)} succeeds
     * @throws DfxTransportException if the socket is closed and no buffered
     *         message remains
     */
    public Optional<byte[]> tryReceiveOnce(Duration wait)
    {
        Objects.requireNonNull(wait, "wait");
        TransportState s = state;
        if (s == TransportState.DISCONNECTED || s == TransportState.CONNECTING) {
            throw new NotConnectedException(s);
        }

        if (!receiveLock.tryLock()) {
            return Optional.empty();
        }
        try {
            byte[] message = inbound.poll();
            if (message != null) {
                return Optional.of(message);
            }
            if (state == TransportState.CLOSED) {
                throw closedException();
            }
            return Optional.ofNullable(inbound.poll(wait.toNanos(), TimeUnit.NANOSECONDS));
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        finally {
            receiveLock.unlock();
        }
    }

    /**
     * Close the connection and release the endpoint. Idempotent, and safe to
     * call after the remote side has already closed.
     */
    @Override
    public void close()
    {
        synchronized (stateLock) {
            state = TransportState.CLOSED;
        }
        connected.countDown();
        stopEndpoint();
    }

    // -------------------------------------------------------------------------
    // MessageEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp()
    {
        synchronized (stateLock) {
            if (state != TransportState.CONNECTING) {
                return;
            }
            state = TransportState.CONNECTED;
        }
        connected.countDown();
        observability.onTransportEvent(new DfxTransportObservabilityEvent(Instant.now(), true, null));
    }

    @Override
    public void onTransportDown(Throwable cause)
    {
        synchronized (stateLock) {
            if (state == TransportState.CLOSED) {
                return;
            }
            closeCause = cause;
            state = TransportState.CLOSED;
        }
        connected.countDown();
        observability.onTransportEvent(new DfxTransportObservabilityEvent(Instant.now(), false, cause));
    }

    @Override
    public void onMessage(byte[] message)
    {
        if (!inbound.offer(message)) {
            DfxTransportException overflow = new DfxTransportException(
                    "Inbound queue full (" + (inbound.size() + inbound.remainingCapacity()) + " messages)");
            observability.onError(new DfxErrorEvent(Instant.now(), overflow.getMessage(), overflow));
            onTransportDown(overflow);
            stopEndpoint();
        }
    }

    // -------------------------------------------------------------------------

    private void requireOpen()
    {
        TransportState s = state;
        if (s == TransportState.DISCONNECTED || s == TransportState.CONNECTING) {
            throw new NotConnectedException(s);
        }
        if (s == TransportState.CLOSED) {
            throw closedException();
        }
    }

    private DfxTransportException closedException()
    {
        Throwable cause = closeCause;
        return cause == null
                ? new DfxTransportException("Socket closed")
                : new DfxTransportException("Socket closed", cause);
    }

    private void failConnect(Throwable cause)
    {
        synchronized (stateLock) {
            if (state != TransportState.CLOSED) {
                closeCause = cause;
                state = TransportState.CLOSED;
            }
        }
        stopEndpoint();
    }

    private void stopEndpoint()
    {
        synchronized (stateLock) {
            if (endpointStopped) {
                return;
            }
            endpointStopped = true;
        }
        endpoint.stop();
    }
}
