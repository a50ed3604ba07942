package com.questrail.dfx.protocol.ws.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * FakeMessageEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link MessageEndpoint} implementation.
 *
 * <p>Stores outbound messages and lets tests inject inbound ones. An optional
 * responder plays the server: every sent message is passed to it and the
 * replies it returns are delivered as inbound messages.</p>
 *
 * <p>It contains no DFX semantics of its own.</p>
 */
public final class FakeMessageEndpoint implements MessageEndpoint {

    private volatile MessageEndpointListener listener;
    private final List<byte[]> sent = new ArrayList<>();
    private volatile boolean connectOnStart = true;
    private volatile RuntimeException sendFailure;
    private volatile Function<byte[], List<byte[]>> responder = m -> List.of();
    private int stopCount;

    @Override
    public void setListener(MessageEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (listener != null && connectOnStart) {
            listener.onTransportUp();
        }
    }

    @Override
    public synchronized void stop() {
        stopCount++;
        if (listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public void send(byte[] message) {
        Objects.requireNonNull(message, "message");
        RuntimeException failure = sendFailure;
        if (failure != null) {
            throw failure;
        }
        synchronized (this) {
            sent.add(message.clone());
        }
        for (byte[] reply : responder.apply(message)) {
            inject(reply);
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void inject(byte[] message) {
        Objects.requireNonNull(message, "message");
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onMessage(message.clone());
    }

    public void dropConnection(Throwable cause) {
        listener.onTransportDown(cause);
    }

    public void setConnectOnStart(boolean connectOnStart) {
        this.connectOnStart = connectOnStart;
    }

    public void failSendsWith(RuntimeException failure) {
        this.sendFailure = failure;
    }

    public void setResponder(Function<byte[], List<byte[]>> responder) {
        this.responder = Objects.requireNonNull(responder, "responder");
    }

    public synchronized List<byte[]> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized int stopCount() {
        return stopCount;
    }
}
