package com.realtimeanalytics.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single recorded measurement. The series it belongs to (name and tags) is
 * carried by the {@link MetricKey} of the buffer that owns it.
 *
 * @since 1.0.0
 */
public final class Sample {

    private final double value;
    private final Instant timestamp;

    public Sample(double value, Instant timestamp) {
        this.value = value;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Sample{value=" + value + ", timestamp=" + timestamp + '}';
    }
}
