package com.realtimeanalytics.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Emitted when a recorded value deviates from its series baseline by at least
 * the configured threshold.
 *
 * <p>
 * Events are ephemeral: the engine publishes them to anomaly subscribers and
 * keeps no copy. Alongside the offending value each event carries the
 * baseline snapshot it was judged against.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metric}, {@code severity} and
 * {@code timestamp} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyEvent {

    private final String metric;
    private final Map<String, String> tags;
    private final double value;
    private final double deviation;
    private final Severity severity;
    private final Instant timestamp;
    private final double baselineMean;
    private final double baselineStdDev;
    private final long baselineCount;

    private AnomalyEvent(Builder builder) {
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.tags = builder.tags != null
                ? Collections.unmodifiableMap(new TreeMap<>(builder.tags))
                : Collections.emptyMap();
        this.value = builder.value;
        this.deviation = builder.deviation;
        this.baselineMean = builder.baselineMean;
        this.baselineStdDev = builder.baselineStdDev;
        this.baselineCount = builder.baselineCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyEvent} instances.
     */
    public static class Builder {
        private String metric;
        private Map<String, String> tags;
        private double value;
        private double deviation;
        private Severity severity;
        private Instant timestamp;
        private double baselineMean;
        private double baselineStdDev;
        private long baselineCount;

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder baselineMean(double baselineMean) {
            this.baselineMean = baselineMean;
            return this;
        }

        public Builder baselineStdDev(double baselineStdDev) {
            this.baselineStdDev = baselineStdDev;
            return this;
        }

        public Builder baselineCount(long baselineCount) {
            this.baselineCount = baselineCount;
            return this;
        }

        public AnomalyEvent build() {
            return new AnomalyEvent(this);
        }
    }

    public String getMetric() {
        return metric;
    }

    /**
     * @return unmodifiable, key-sorted tags
     */
    public Map<String, String> getTags() {
        return tags;
    }

    public double getValue() {
        return value;
    }

    /**
     * Distance from the baseline mean in standard deviations. Infinite when
     * the baseline has zero variance.
     *
     * @return normalized deviation
     */
    public double getDeviation() {
        return deviation;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getBaselineStdDev() {
        return baselineStdDev;
    }

    public long getBaselineCount() {
        return baselineCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyEvent that))
            return false;
        return Double.compare(value, that.value) == 0
                && metric.equals(that.metric)
                && tags.equals(that.tags)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, tags, value, timestamp);
    }

    @Override
    public String toString() {
        return "AnomalyEvent{" +
                "metric='" + metric + '\'' +
                ", tags=" + tags +
                ", value=" + value +
                ", deviation=" + String.format("%.2f", deviation) +
                ", severity=" + severity.label() +
                ", timestamp=" + timestamp +
                '}';
    }
}
