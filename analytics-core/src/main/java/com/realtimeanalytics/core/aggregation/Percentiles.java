package com.realtimeanalytics.core.aggregation;

import java.util.Objects;

/**
 * Nearest-rank percentile lookup on sorted data.
 *
 * <p>
 * For {@code n} sorted values and a percentile {@code p} in {@code [0, 1]}
 * the result is {@code v[ceil(p × n) − 1]}, clamped to {@code [0, n − 1]}.
 * On {@code [10, 20, 30, 40, 50]} this gives p50 = 30, p95 = 50, p99 = 50;
 * on {@code [1..10]} it gives p50 = 5, p90 = 9, p95 = 10.
 * The index {@code Math.rint(p × (n − 1))} (half-even rounding) agrees on all
 * of these examples.
 * </p>
 *
 * @since 1.0.0
 */
public final class Percentiles {

    /** Absorbs representation error such as {@code 0.07 × 100 = 7.000000000000001}. */
    private static final double RANK_EPSILON = 1e-9;

    private Percentiles() {
        // utility class — not instantiable
    }

    /**
     * @param sortedValues values in ascending order; must not be empty
     * @param p            percentile as a fraction in {@code [0, 1]}
     * @return the nearest-rank value
     * @throws IllegalArgumentException if the array is empty or {@code p} is out
     *                                  of range
     */
    public static double nearestRank(double[] sortedValues, double p) {
        Objects.requireNonNull(sortedValues, "sortedValues must not be null");
        if (sortedValues.length == 0) {
            throw new IllegalArgumentException("Cannot take a percentile of no values");
        }
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new IllegalArgumentException("Percentile must be in [0, 1], got: " + p);
        }
        int n = sortedValues.length;
        int index = (int) Math.ceil(p * n - RANK_EPSILON) - 1;
        return sortedValues[Math.max(0, Math.min(n - 1, index))];
    }
}
