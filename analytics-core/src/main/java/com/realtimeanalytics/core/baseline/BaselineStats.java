package com.realtimeanalytics.core.baseline;

import com.realtimeanalytics.core.model.Aggregation;

import java.util.Objects;

/**
 * Immutable running statistics of a series, the reference against which new
 * values are judged.
 *
 * <p>
 * Baselines only ever grow by folding in whole {@link Aggregation}s, never
 * raw samples. The fold combines batch moments with the parallel form of
 * Welford's update, so {@code stdDev} stays accurate for long-running series
 * where the textbook {@code sumSquares / count − mean²} identity would cancel
 * catastrophically. {@code sumSquares} (Σv²) is still tracked.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineStats {

    /** Baseline of a series that has not been aggregated yet. */
    public static final BaselineStats EMPTY = new BaselineStats(0, 0.0, 0.0, 0.0, 0.0);

    private final long count;
    private final double sum;
    private final double sumSquares;
    private final double mean;
    private final double sumSquaredDeviations;
    private final double stdDev;

    private BaselineStats(long count, double sum, double sumSquares, double mean, double sumSquaredDeviations) {
        this.count = count;
        this.sum = sum;
        this.sumSquares = sumSquares;
        this.mean = mean;
        this.sumSquaredDeviations = Math.max(0.0, sumSquaredDeviations);
        this.stdDev = count > 0 ? Math.sqrt(this.sumSquaredDeviations / count) : 0.0;
    }

    /**
     * Baseline from summary values, as reloaded from storage or given in tests.
     *
     * @param count  number of samples; must not be negative
     * @param mean   mean of the samples
     * @param stdDev population standard deviation; must not be negative
     * @return the baseline
     */
    public static BaselineStats of(long count, double mean, double stdDev) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        if (stdDev < 0) {
            throw new IllegalArgumentException("stdDev must be >= 0, got: " + stdDev);
        }
        if (count == 0) {
            return EMPTY;
        }
        double m2 = stdDev * stdDev * count;
        return new BaselineStats(count, mean * count, m2 + count * mean * mean, mean, m2);
    }

    /**
     * Fold a completed aggregation into this baseline.
     *
     * @param aggregation the batch summary
     * @return the combined baseline; {@code this} is unchanged
     */
    public BaselineStats fold(Aggregation aggregation) {
        Objects.requireNonNull(aggregation, "aggregation must not be null");
        long batchCount = aggregation.getCount();
        long newCount = count + batchCount;
        double newSum = sum + aggregation.getSum();
        double newMean = newSum / newCount;
        double delta = aggregation.getAvg() - mean;
        double newM2 = sumSquaredDeviations
                + aggregation.getSumSquaredDeviations()
                + delta * delta * ((double) count * batchCount / newCount);
        return new BaselineStats(newCount, newSum, sumSquares + aggregation.getSumSquares(), newMean, newM2);
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getSum() {
        return sum;
    }

    /**
     * @return Σv² over every folded sample
     */
    public double getSumSquares() {
        return sumSquares;
    }

    public double getVariance() {
        return count > 0 ? sumSquaredDeviations / count : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BaselineStats that))
            return false;
        return count == that.count
                && Double.compare(sum, that.sum) == 0
                && Double.compare(mean, that.mean) == 0
                && Double.compare(sumSquaredDeviations, that.sumSquaredDeviations) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, sum, mean, sumSquaredDeviations);
    }

    @Override
    public String toString() {
        return "BaselineStats{" +
                "count=" + count +
                ", mean=" + mean +
                ", stdDev=" + stdDev +
                ", sum=" + sum +
                ", sumSquares=" + sumSquares +
                '}';
    }
}
