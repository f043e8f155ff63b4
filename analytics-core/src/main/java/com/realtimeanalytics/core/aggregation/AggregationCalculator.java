package com.realtimeanalytics.core.aggregation;

import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.Sample;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Computes the {@link Aggregation} of a drained batch.
 *
 * <p>
 * Count, sum, min, max, last, both timestamps and the batch moments are
 * collected in a single pass (Welford's update for the squared deviations);
 * percentiles are read from one sorted copy of the values.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregationCalculator {

    private AggregationCalculator() {
        // utility class — not instantiable
    }

    /**
     * @param samples batch in append order; must not be empty
     * @return the batch summary
     * @throws IllegalArgumentException if {@code samples} is empty
     */
    public static Aggregation summarize(List<Sample> samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty batch");
        }

        int n = samples.size();
        double[] values = new double[n];
        double sum = 0;
        double sumSquares = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double mean = 0;
        double m2 = 0;
        Instant start = null;
        Instant end = null;
        double last = 0;

        for (int i = 0; i < n; i++) {
            Sample sample = samples.get(i);
            double v = sample.getValue();
            values[i] = v;
            sum += v;
            sumSquares += v * v;
            min = Math.min(min, v);
            max = Math.max(max, v);

            double delta = v - mean;
            mean += delta / (i + 1);
            m2 += delta * (v - mean);

            Instant ts = sample.getTimestamp();
            if (start == null || ts.isBefore(start)) {
                start = ts;
            }
            // ties go to the later append
            if (end == null || !ts.isBefore(end)) {
                end = ts;
                last = v;
            }
        }

        Arrays.sort(values);

        return Aggregation.builder()
                .count(n)
                .sum(sum)
                .min(min)
                .max(max)
                .last(last)
                .p50(Percentiles.nearestRank(values, 0.50))
                .p95(Percentiles.nearestRank(values, 0.95))
                .p99(Percentiles.nearestRank(values, 0.99))
                .sumSquares(sumSquares)
                .sumSquaredDeviations(m2)
                .startTime(start)
                .endTime(end)
                .build();
    }
}
