package com.questrail.dfx.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Measurement modes and the server-side length limit of one measurement in
 * each. A recording longer than the limit is split across measurements.
 */
public enum MeasurementMode
{
    DISCRETE(Duration.ofSeconds(120)),
    BATCH(Duration.ofSeconds(1200)),
    VIDEO(Duration.ofSeconds(1200)),
    STREAMING(Duration.ofSeconds(1200));

    private final Duration maxMeasurementLength;

    MeasurementMode(Duration maxMeasurementLength) {
        this.maxMeasurementLength = maxMeasurementLength;
    }

    public Duration maxMeasurementLength() {
        return maxMeasurementLength;
    }

    /**
     * @throws IllegalArgumentException for an unknown mode name
     */
    public static MeasurementMode fromName(String name) {
        if (name != null) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            }
            catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid measurement mode given: " + name, e);
            }
        }
        throw new IllegalArgumentException("Invalid measurement mode given: null");
    }
}
