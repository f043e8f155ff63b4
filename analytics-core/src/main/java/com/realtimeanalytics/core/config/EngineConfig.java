package com.realtimeanalytics.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typed, immutable configuration for an
 * {@link com.realtimeanalytics.core.engine.AnalyticsEngine}.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #defaults()} for the stock settings, the {@link Builder} for
 * programmatic / test scenarios, or {@link EngineConfigLoader} to read a YAML
 * file. The builder validates every value at {@link Builder#build()} time so
 * that an engine is never constructed from an invalid configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfig {

    public static final List<Integer> DEFAULT_WINDOW_SIZES = List.of(60, 300, 900, 3600);

    // ---------------------------------------------------------------
    // Hot path
    // ---------------------------------------------------------------
    private final List<Integer> windowSizesSeconds;
    private final int bufferOverflowThreshold;

    // ---------------------------------------------------------------
    // Anomaly detection
    // ---------------------------------------------------------------
    private final double anomalyThreshold;
    private final long minimumSamples;
    private final Duration baselineLookback;

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------
    private final Duration aggregationInterval;
    private final Duration retention;
    private final Duration retentionCheckInterval;
    private final Duration shutdownTimeout;

    // ---------------------------------------------------------------
    // Storage retries
    // ---------------------------------------------------------------
    private final int retryMaxAttempts;
    private final Duration retryInitialBackoff;
    private final Duration retryMaxBackoff;

    private EngineConfig(Builder b) {
        this.windowSizesSeconds = Collections.unmodifiableList(new ArrayList<>(b.windowSizesSeconds));
        this.bufferOverflowThreshold = b.bufferOverflowThreshold;
        this.anomalyThreshold = b.anomalyThreshold;
        this.minimumSamples = b.minimumSamples;
        this.baselineLookback = b.baselineLookback;
        this.aggregationInterval = b.aggregationInterval;
        this.retention = b.retention;
        this.retentionCheckInterval = b.retentionCheckInterval;
        this.shutdownTimeout = b.shutdownTimeout;
        this.retryMaxAttempts = b.retryMaxAttempts;
        this.retryInitialBackoff = b.retryInitialBackoff;
        this.retryMaxBackoff = b.retryMaxBackoff;
    }

    /**
     * @return configuration with every value at its default
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return moving-average window sizes in seconds, unmodifiable
     */
    public List<Integer> getWindowSizesSeconds() {
        return windowSizesSeconds;
    }

    public int getBufferOverflowThreshold() {
        return bufferOverflowThreshold;
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public long getMinimumSamples() {
        return minimumSamples;
    }

    public Duration getBaselineLookback() {
        return baselineLookback;
    }

    public Duration getAggregationInterval() {
        return aggregationInterval;
    }

    public Duration getRetention() {
        return retention;
    }

    public Duration getRetentionCheckInterval() {
        return retentionCheckInterval;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public Duration getRetryInitialBackoff() {
        return retryInitialBackoff;
    }

    public Duration getRetryMaxBackoff() {
        return retryMaxBackoff;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineConfig}.
     *
     * <p>
     * {@link #build()} rejects empty, non-positive or duplicate window sizes,
     * non-positive thresholds and intervals, and a maximum backoff smaller
     * than the initial one.
     * </p>
     */
    public static class Builder {
        private List<Integer> windowSizesSeconds = DEFAULT_WINDOW_SIZES;
        private int bufferOverflowThreshold = 1000;
        private double anomalyThreshold = 3.0;
        private long minimumSamples = 30;
        private Duration baselineLookback = Duration.ofDays(7);
        private Duration aggregationInterval = Duration.ofMillis(5000);
        private Duration retention = Duration.ofDays(30);
        private Duration retentionCheckInterval = Duration.ofHours(1);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private int retryMaxAttempts = 3;
        private Duration retryInitialBackoff = Duration.ofMillis(100);
        private Duration retryMaxBackoff = Duration.ofSeconds(5);

        public Builder windowSizesSeconds(List<Integer> v) {
            this.windowSizesSeconds = v;
            return this;
        }

        public Builder windowSizesSeconds(Integer... v) {
            this.windowSizesSeconds = List.of(v);
            return this;
        }

        public Builder bufferOverflowThreshold(int v) {
            this.bufferOverflowThreshold = v;
            return this;
        }

        public Builder anomalyThreshold(double v) {
            this.anomalyThreshold = v;
            return this;
        }

        public Builder minimumSamples(long v) {
            this.minimumSamples = v;
            return this;
        }

        public Builder baselineLookback(Duration v) {
            this.baselineLookback = v;
            return this;
        }

        public Builder aggregationInterval(Duration v) {
            this.aggregationInterval = v;
            return this;
        }

        public Builder retention(Duration v) {
            this.retention = v;
            return this;
        }

        public Builder retentionCheckInterval(Duration v) {
            this.retentionCheckInterval = v;
            return this;
        }

        public Builder shutdownTimeout(Duration v) {
            this.shutdownTimeout = v;
            return this;
        }

        public Builder retryMaxAttempts(int v) {
            this.retryMaxAttempts = v;
            return this;
        }

        public Builder retryInitialBackoff(Duration v) {
            this.retryInitialBackoff = v;
            return this;
        }

        public Builder retryMaxBackoff(Duration v) {
            this.retryMaxBackoff = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link EngineConfig}
         * @throws IllegalArgumentException listing every invalid value
         */
        public EngineConfig build() {
            List<String> errors = new ArrayList<>();

            if (windowSizesSeconds == null || windowSizesSeconds.isEmpty()) {
                errors.add("windowSizesSeconds must contain at least one window");
            } else {
                Set<Integer> seen = new HashSet<>();
                for (Integer size : windowSizesSeconds) {
                    if (size == null || size <= 0) {
                        errors.add("window size must be > 0, got: " + size);
                    } else if (!seen.add(size)) {
                        errors.add("duplicate window size: " + size);
                    }
                }
            }
            if (bufferOverflowThreshold < 1) {
                errors.add("bufferOverflowThreshold must be >= 1, got: " + bufferOverflowThreshold);
            }
            if (!(anomalyThreshold > 0) || Double.isInfinite(anomalyThreshold)) {
                errors.add("anomalyThreshold must be a positive finite number, got: " + anomalyThreshold);
            }
            if (minimumSamples < 1) {
                errors.add("minimumSamples must be >= 1, got: " + minimumSamples);
            }
            requirePositive(errors, baselineLookback, "baselineLookback");
            requirePositive(errors, aggregationInterval, "aggregationInterval");
            requirePositive(errors, retention, "retention");
            requirePositive(errors, retentionCheckInterval, "retentionCheckInterval");
            requirePositive(errors, shutdownTimeout, "shutdownTimeout");
            if (retryMaxAttempts < 1) {
                errors.add("retryMaxAttempts must be >= 1, got: " + retryMaxAttempts);
            }
            requirePositive(errors, retryInitialBackoff, "retryInitialBackoff");
            requirePositive(errors, retryMaxBackoff, "retryMaxBackoff");
            if (retryInitialBackoff != null && retryMaxBackoff != null
                    && retryMaxBackoff.compareTo(retryInitialBackoff) < 0) {
                errors.add("retryMaxBackoff must be >= retryInitialBackoff");
            }

            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid EngineConfig: " + String.join("; ", errors));
            }
            return new EngineConfig(this);
        }

        private static void requirePositive(List<String> errors, Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                errors.add(name + " must be a positive duration, got: " + value);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EngineConfig that))
            return false;
        return bufferOverflowThreshold == that.bufferOverflowThreshold
                && Double.compare(anomalyThreshold, that.anomalyThreshold) == 0
                && minimumSamples == that.minimumSamples
                && retryMaxAttempts == that.retryMaxAttempts
                && windowSizesSeconds.equals(that.windowSizesSeconds)
                && baselineLookback.equals(that.baselineLookback)
                && aggregationInterval.equals(that.aggregationInterval)
                && retention.equals(that.retention)
                && retentionCheckInterval.equals(that.retentionCheckInterval)
                && shutdownTimeout.equals(that.shutdownTimeout)
                && retryInitialBackoff.equals(that.retryInitialBackoff)
                && retryMaxBackoff.equals(that.retryMaxBackoff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(windowSizesSeconds, bufferOverflowThreshold, anomalyThreshold,
                minimumSamples, aggregationInterval, retention);
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "windowSizesSeconds=" + windowSizesSeconds +
                ", bufferOverflowThreshold=" + bufferOverflowThreshold +
                ", anomalyThreshold=" + anomalyThreshold +
                ", minimumSamples=" + minimumSamples +
                ", baselineLookback=" + baselineLookback +
                ", aggregationInterval=" + aggregationInterval +
                ", retention=" + retention +
                ", retentionCheckInterval=" + retentionCheckInterval +
                ", shutdownTimeout=" + shutdownTimeout +
                ", retryMaxAttempts=" + retryMaxAttempts +
                ", retryInitialBackoff=" + retryInitialBackoff +
                ", retryMaxBackoff=" + retryMaxBackoff +
                '}';
    }
}
