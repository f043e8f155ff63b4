package com.realtimeanalytics.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Bucket width used when reading aggregate history.
 *
 * @since 1.0.0
 */
public enum Granularity {

    /** One row per persisted aggregation. */
    RAW(Duration.ZERO),
    MINUTE(Duration.ofMinutes(1)),
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1));

    private final Duration width;

    Granularity(Duration width) {
        this.width = width;
    }

    public Duration getWidth() {
        return width;
    }

    /**
     * Floor an instant to the start of its bucket. {@link #RAW} returns the
     * instant unchanged.
     *
     * @param instant the instant to bucket
     * @return bucket start
     */
    public Instant bucketStart(Instant instant) {
        if (this == RAW) {
            return instant;
        }
        long widthMs = width.toMillis();
        long epochMs = instant.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(epochMs, widthMs) * widthMs);
    }
}
