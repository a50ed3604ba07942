package com.questrail.dfx.protocol.ws.internal.time;

/**
 * Clock behind the add-data acknowledgement deadline.
 *
 * <p>{@link com.questrail.dfx.protocol.ws.internal.exec.ChunkUploadFlow} reads it
 * once when a chunk is sent and again after every inbound message; the chunk
 * times out when no message has arrived for the configured ack timeout.
 * Observability events keep using {@code Instant.now()}.</p>
 *
 * <p>{@link SystemMonotonicClock} is the production source. Tests step a
 * manual clock so a thirty-second ack timeout elapses without sleeping.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    /** Nanosecond tick; only differences between two reads carry meaning. */
    long nowNanos();
}
