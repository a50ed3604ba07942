package com.questrail.dfx.protocol.ws.internal.route;

import com.questrail.dfx.protocol.ws.codec.DfxFrameDecoder;
import com.questrail.dfx.protocol.ws.internal.frame.DfxInboundMessage;
import com.questrail.dfx.protocol.ws.observability.DfxObservabilitySink;
import com.questrail.dfx.protocol.ws.observability.DfxProtocolObservabilityEvent;
import com.questrail.dfx.protocol.ws.observability.NullObservabilitySink;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * ResponseRouter
 * =============================================================================
 * Demultiplexes inbound WebSocket messages into three FIFO queues, one per
 * {@link com.questrail.dfx.protocol.ws.internal.frame.InboundKind}.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Classification is delegated to the decoder (length only).</li>
 *   <li>Every ingested message lands in exactly one queue and is never re-queued.</li>
 *   <li>A message whose leading 10 bytes differ from this connection's id is
 *       <em>also</em> recorded as an unrecognized sender. That record is
 *       diagnostic only; flows never read it.</li>
 *   <li>No body content is transformed or validated here.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>Queues are lock-free concurrent queues: ingestion and draining may happen on
 * different threads. The unrecognized-sender map is an access-ordered LRU bounded
 * to {@link #DEFAULT_UNRECOGNIZED_CAPACITY} entries and guarded by its own monitor.</p>
 */
public final class ResponseRouter
{
    public static final int DEFAULT_UNRECOGNIZED_CAPACITY = 64;

    private final DfxFrameDecoder decoder;
    private final DfxObservabilitySink observability;

    private final Queue<DfxInboundMessage> addDataStatus = new ConcurrentLinkedQueue<>();
    private final Queue<DfxInboundMessage> subscribeStatus = new ConcurrentLinkedQueue<>();
    private final Queue<DfxInboundMessage> resultChunks = new ConcurrentLinkedQueue<>();

    private final Map<String, DfxInboundMessage> unrecognized;

    public ResponseRouter(DfxFrameDecoder decoder)
    {
        this(decoder, NullObservabilitySink.INSTANCE, DEFAULT_UNRECOGNIZED_CAPACITY);
    }

    public ResponseRouter(DfxFrameDecoder decoder, DfxObservabilitySink observability, int unrecognizedCapacity)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.observability = Objects.requireNonNull(observability, "observability");
        if (unrecognizedCapacity < 1) {
            throw new IllegalArgumentException("unrecognizedCapacity must be >= 1");
        }
        this.unrecognized = new BoundedLruMap<>(unrecognizedCapacity);
    }

    /**
     * Classify {@code message} and append it to the matching queue.
     *
     * @param message raw inbound bytes
     * @param selfConnectionId this socket's connection id
     */
    public void ingest(byte[] message, String selfConnectionId)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(selfConnectionId, "selfConnectionId");

        DfxInboundMessage inbound = decoder.decode(message);

        switch (inbound.kind()) {
            case SUBSCRIBE_STATUS:
                subscribeStatus.add(inbound);
                break;
            case ADD_DATA_STATUS:
                addDataStatus.add(inbound);
                break;
            case RESULT_CHUNK:
                resultChunks.add(inbound);
                break;
            default:
                throw new IllegalStateException("Unhandled kind: " + inbound.kind());
        }

        String sender = inbound.senderId();
        if (!sender.equals(selfConnectionId)) {
            synchronized (unrecognized) {
                unrecognized.put(sender, inbound);
            }
            observability.onProtocolEvent(new DfxProtocolObservabilityEvent(
                    Instant.now(),
                    DfxProtocolObservabilityEvent.Kind.UNRECOGNIZED_SENDER,
                    null,
                    "sender=" + sender + " kind=" + inbound.kind()));
        }
    }

    public Optional<DfxInboundMessage> popAddDataStatus()
    {
        return Optional.ofNullable(addDataStatus.poll());
    }

    public Optional<DfxInboundMessage> popSubscribeStatus()
    {
        return Optional.ofNullable(subscribeStatus.poll());
    }

    public Optional<DfxInboundMessage> popResultChunk()
    {
        return Optional.ofNullable(resultChunks.poll());
    }

    /**
     * Most recent message seen from a sender other than this connection, if
     * that sender is still within the LRU window.
     */
    public Optional<DfxInboundMessage> lastUnrecognized(String senderId)
    {
        synchronized (unrecognized) {
            return Optional.ofNullable(unrecognized.get(senderId));
        }
    }

    public int unrecognizedCount()
    {
        synchronized (unrecognized) {
            return unrecognized.size();
        }
    }

    /**
     * Drops everything queued. Used when a measurement session ends.
     */
    public void clear()
    {
        addDataStatus.clear();
        subscribeStatus.clear();
        resultChunks.clear();
        synchronized (unrecognized) {
            unrecognized.clear();
        }
    }

    private static final class BoundedLruMap<K, V> extends LinkedHashMap<K, V>
    {
        private final int capacity;

        BoundedLruMap(int capacity)
        {
            super(16, 0.75f, true);
            this.capacity = capacity;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<K, V> eldest)
        {
            return size() > capacity;
        }
    }
}
