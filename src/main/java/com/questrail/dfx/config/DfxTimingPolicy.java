package com.questrail.dfx.config;

import java.time.Duration;
import java.util.Objects;

/**
 * DfxTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing of the client.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>ackTimeout</b>: How long an add-data upload waits for its
 *       acknowledgement, measured from the last message received.</li>
 *   <li><b>receivePollInterval</b>: How long one receive attempt waits for a
 *       message. Also the polling cadence of the measurement-rotation handshake.</li>
 *   <li><b>connectTimeout</b>: Limit on the WebSocket opening handshake.</li>
 *   <li><b>rotationSignalDelay</b>: Pause after a measurement is rotated, and
 *       between subscription cycles, so the other side observes the change.</li>
 *   <li><b>paceUploads</b>: Whether each chunk upload is followed by a pause of
 *       the chunk's duration, keeping uploads at real-time rate.</li>
 * </ul>
 */
public record DfxTimingPolicy(
        Duration ackTimeout,
        Duration receivePollInterval,
        Duration connectTimeout,
        Duration rotationSignalDelay,
        boolean paceUploads
) {
    public DfxTimingPolicy {
        Objects.requireNonNull(ackTimeout, "ackTimeout");
        Objects.requireNonNull(receivePollInterval, "receivePollInterval");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(rotationSignalDelay, "rotationSignalDelay");

        if (ackTimeout.isNegative() || ackTimeout.isZero()) {
            throw new IllegalArgumentException("ackTimeout must be positive");
        }
        if (receivePollInterval.isNegative()) {
            throw new IllegalArgumentException("receivePollInterval must be non-negative");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (rotationSignalDelay.isNegative()) {
            throw new IllegalArgumentException("rotationSignalDelay must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>ackTimeout: 30s</li>
     *   <li>receivePollInterval: 200ms</li>
     *   <li>connectTimeout: 10s</li>
     *   <li>rotationSignalDelay: 500ms</li>
     *   <li>paceUploads: true</li>
     * </ul>
     */
    public static DfxTimingPolicy defaults() {
        return new DfxTimingPolicy(
                Duration.ofSeconds(30),
                Duration.ofMillis(200),
                Duration.ofSeconds(10),
                Duration.ofMillis(500),
                true
        );
    }

    public DfxTimingPolicy withAckTimeout(Duration ackTimeout) {
        return new DfxTimingPolicy(ackTimeout, receivePollInterval, connectTimeout, rotationSignalDelay, paceUploads);
    }

    public DfxTimingPolicy withPaceUploads(boolean paceUploads) {
        return new DfxTimingPolicy(ackTimeout, receivePollInterval, connectTimeout, rotationSignalDelay, paceUploads);
    }
}
