package com.realtimeanalytics.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * windowSizes: [60, 300, 900, 3600]
 * aggregationIntervalMs: 5000
 * bufferOverflowThreshold: 1000
 * anomalyThreshold: 3.0
 * minimumSamples: 30
 * baselineLookbackSeconds: 604800
 * retentionSeconds: 2592000
 * retentionCheckIntervalMs: 3600000
 * shutdownTimeoutMs: 10000
 * retry:
 *   maxAttempts: 3
 *   initialBackoffMs: 100
 *   maxBackoffMs: 5000
 * </pre>
 *
 * <p>
 * Missing keys keep the {@link EngineConfig} defaults. Call
 * {@link #toConfig()} to validate and convert.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineSettings {

    private List<Integer> windowSizes;
    private Long aggregationIntervalMs;
    private Integer bufferOverflowThreshold;
    private Double anomalyThreshold;
    private Long minimumSamples;
    private Long baselineLookbackSeconds;
    private Long retentionSeconds;
    private Long retentionCheckIntervalMs;
    private Long shutdownTimeoutMs;
    private RetrySettings retry = new RetrySettings();

    /**
     * Convert to a validated {@link EngineConfig}.
     *
     * @return the configuration
     * @throws IllegalArgumentException if any value is invalid
     */
    public EngineConfig toConfig() {
        EngineConfig.Builder builder = EngineConfig.builder();
        if (windowSizes != null) {
            builder.windowSizesSeconds(new ArrayList<>(windowSizes));
        }
        if (aggregationIntervalMs != null) {
            builder.aggregationInterval(Duration.ofMillis(aggregationIntervalMs));
        }
        if (bufferOverflowThreshold != null) {
            builder.bufferOverflowThreshold(bufferOverflowThreshold);
        }
        if (anomalyThreshold != null) {
            builder.anomalyThreshold(anomalyThreshold);
        }
        if (minimumSamples != null) {
            builder.minimumSamples(minimumSamples);
        }
        if (baselineLookbackSeconds != null) {
            builder.baselineLookback(Duration.ofSeconds(baselineLookbackSeconds));
        }
        if (retentionSeconds != null) {
            builder.retention(Duration.ofSeconds(retentionSeconds));
        }
        if (retentionCheckIntervalMs != null) {
            builder.retentionCheckInterval(Duration.ofMillis(retentionCheckIntervalMs));
        }
        if (shutdownTimeoutMs != null) {
            builder.shutdownTimeout(Duration.ofMillis(shutdownTimeoutMs));
        }
        if (retry != null) {
            retry.applyTo(builder);
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public List<Integer> getWindowSizes() {
        return windowSizes;
    }

    public void setWindowSizes(List<Integer> windowSizes) {
        this.windowSizes = windowSizes;
    }

    public Long getAggregationIntervalMs() {
        return aggregationIntervalMs;
    }

    public void setAggregationIntervalMs(Long aggregationIntervalMs) {
        this.aggregationIntervalMs = aggregationIntervalMs;
    }

    public Integer getBufferOverflowThreshold() {
        return bufferOverflowThreshold;
    }

    public void setBufferOverflowThreshold(Integer bufferOverflowThreshold) {
        this.bufferOverflowThreshold = bufferOverflowThreshold;
    }

    public Double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public void setAnomalyThreshold(Double anomalyThreshold) {
        this.anomalyThreshold = anomalyThreshold;
    }

    public Long getMinimumSamples() {
        return minimumSamples;
    }

    public void setMinimumSamples(Long minimumSamples) {
        this.minimumSamples = minimumSamples;
    }

    public Long getBaselineLookbackSeconds() {
        return baselineLookbackSeconds;
    }

    public void setBaselineLookbackSeconds(Long baselineLookbackSeconds) {
        this.baselineLookbackSeconds = baselineLookbackSeconds;
    }

    public Long getRetentionSeconds() {
        return retentionSeconds;
    }

    public void setRetentionSeconds(Long retentionSeconds) {
        this.retentionSeconds = retentionSeconds;
    }

    public Long getRetentionCheckIntervalMs() {
        return retentionCheckIntervalMs;
    }

    public void setRetentionCheckIntervalMs(Long retentionCheckIntervalMs) {
        this.retentionCheckIntervalMs = retentionCheckIntervalMs;
    }

    public Long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(Long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public RetrySettings getRetry() {
        return retry;
    }

    public void setRetry(RetrySettings retry) {
        this.retry = retry;
    }

    /**
     * Storage retry block of the YAML configuration.
     */
    public static class RetrySettings {
        private Integer maxAttempts;
        private Long initialBackoffMs;
        private Long maxBackoffMs;

        void applyTo(EngineConfig.Builder builder) {
            if (maxAttempts != null) {
                builder.retryMaxAttempts(maxAttempts);
            }
            if (initialBackoffMs != null) {
                builder.retryInitialBackoff(Duration.ofMillis(initialBackoffMs));
            }
            if (maxBackoffMs != null) {
                builder.retryMaxBackoff(Duration.ofMillis(maxBackoffMs));
            }
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(Long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public Long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(Long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "windowSizes=" + windowSizes +
                ", aggregationIntervalMs=" + aggregationIntervalMs +
                ", bufferOverflowThreshold=" + bufferOverflowThreshold +
                ", anomalyThreshold=" + anomalyThreshold +
                ", minimumSamples=" + minimumSamples +
                '}';
    }
}
