package com.realtimeanalytics.core.detection;

import com.realtimeanalytics.core.baseline.BaselineStats;
import com.realtimeanalytics.core.baseline.BaselineStatsStore;
import com.realtimeanalytics.core.model.AnomalyEvent;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Z-score detector against the aggregated baseline of each series.
 *
 * <p>
 * The deviation of a value is {@code |value − mean| / stdDev}. Values with a
 * deviation below {@code threshold} are normal, values below
 * {@code 2 × threshold} are {@link Severity#MEDIUM}, everything beyond is
 * {@link Severity#HIGH}.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * No decision is made until the baseline has folded at least
 * {@code minimumSamples} samples.
 * </p>
 *
 * <h3>Constant series</h3>
 * <p>
 * A baseline with zero variance makes any change structurally anomalous:
 * a value different from the mean gets an infinite deviation and
 * {@link Severity#HIGH}; a value equal to the mean is normal.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineAnomalyDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineAnomalyDetector.class);

    private final BaselineStatsStore baselines;
    private final double threshold;
    private final long minimumSamples;

    /**
     * @param baselines      baseline source; must not be {@code null}
     * @param threshold      deviation (in standard deviations) at which a value
     *                       becomes anomalous; must be positive
     * @param minimumSamples samples a baseline needs before it is trusted
     * @throws IllegalArgumentException if {@code threshold} or
     *                                  {@code minimumSamples} is invalid
     */
    public BaselineAnomalyDetector(BaselineStatsStore baselines, double threshold, long minimumSamples) {
        this.baselines = Objects.requireNonNull(baselines, "BaselineStatsStore must not be null");
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("threshold must be a positive finite number, got: " + threshold);
        }
        if (minimumSamples < 1) {
            throw new IllegalArgumentException("minimumSamples must be >= 1, got: " + minimumSamples);
        }
        this.threshold = threshold;
        this.minimumSamples = minimumSamples;
    }

    @Override
    public Optional<AnomalyEvent> detect(MetricKey key, double value, Instant timestamp) {
        if (key == null || timestamp == null || !Double.isFinite(value)) {
            return Optional.empty();
        }

        Optional<BaselineStats> found = baselines.get(key);
        if (found.isEmpty() || found.get().getCount() < minimumSamples) {
            LOG.trace("Metric [{}]: baseline not warmed up – skipping", key);
            return Optional.empty();
        }
        BaselineStats baseline = found.get();

        double deviation = deviation(value, baseline);
        Optional<Severity> severity = classify(deviation);
        if (severity.isEmpty()) {
            return Optional.empty();
        }

        LOG.debug("Metric [{}] anomalous: value={} mean={} stdDev={} deviation={}",
                key, value, baseline.getMean(), baseline.getStdDev(), deviation);

        return Optional.of(AnomalyEvent.builder()
                .metric(key.getName())
                .tags(key.getTags())
                .value(value)
                .deviation(deviation)
                .severity(severity.get())
                .timestamp(timestamp)
                .baselineMean(baseline.getMean())
                .baselineStdDev(baseline.getStdDev())
                .baselineCount(baseline.getCount())
                .build());
    }

    /**
     * Map a deviation to a severity.
     *
     * @param deviation normalized deviation, may be infinite
     * @return the severity, or empty below the threshold
     */
    Optional<Severity> classify(double deviation) {
        if (Double.isNaN(deviation) || deviation < threshold) {
            return Optional.empty();
        }
        return Optional.of(deviation < 2 * threshold ? Severity.MEDIUM : Severity.HIGH);
    }

    private static double deviation(double value, BaselineStats baseline) {
        double diff = Math.abs(value - baseline.getMean());
        if (baseline.getStdDev() == 0) {
            return diff == 0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return diff / baseline.getStdDev();
    }

    public double getThreshold() {
        return threshold;
    }

    public long getMinimumSamples() {
        return minimumSamples;
    }
}
