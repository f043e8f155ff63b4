package com.realtimeanalytics.core.event;

import com.realtimeanalytics.core.model.MetricKey;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes a failure the engine could not surface to a caller directly:
 * persistence, baseline loading, retention or aggregation problems.
 *
 * @since 1.0.0
 */
public final class EngineError {

    /** Where the failure happened. */
    public enum Kind {
        PERSISTENCE,
        BASELINE_LOAD,
        RETENTION,
        AGGREGATION
    }

    private final Kind kind;
    private final MetricKey metricKey;
    private final String message;
    private final Throwable cause;
    private final Instant timestamp;

    /**
     * @param kind      failure category
     * @param metricKey affected series, {@code null} when not key-specific
     * @param message   human-readable description
     * @param cause     underlying exception, may be {@code null}
     * @param timestamp when the failure was observed
     */
    public EngineError(Kind kind, MetricKey metricKey, String message, Throwable cause, Instant timestamp) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.metricKey = metricKey;
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.cause = cause;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<MetricKey> getMetricKey() {
        return Optional.ofNullable(metricKey);
    }

    public String getMessage() {
        return message;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "EngineError{" +
                "kind=" + kind +
                ", metricKey=" + metricKey +
                ", message='" + message + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
