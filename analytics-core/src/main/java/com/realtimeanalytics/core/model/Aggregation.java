package com.realtimeanalytics.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable statistical summary of one drained batch of samples.
 *
 * <p>
 * Besides the reported statistics the summary keeps two moments of the batch,
 * {@code sumSquares} (Σv²) and {@code sumSquaredDeviations} (Σ(v − avg)²), so
 * that it can be folded into a running baseline without revisiting samples.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code count} must be positive and both
 * timestamps are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class Aggregation {

    private final long count;
    private final double sum;
    private final double min;
    private final double max;
    private final double avg;
    private final double last;
    private final double p50;
    private final double p95;
    private final double p99;
    private final double sumSquares;
    private final double sumSquaredDeviations;
    private final Instant startTime;
    private final Instant endTime;

    private Aggregation(Builder b) {
        if (b.count <= 0) {
            throw new IllegalArgumentException("count must be > 0, got: " + b.count);
        }
        this.count = b.count;
        this.sum = b.sum;
        this.min = b.min;
        this.max = b.max;
        this.avg = b.sum / b.count;
        this.last = b.last;
        this.p50 = b.p50;
        this.p95 = b.p95;
        this.p99 = b.p99;
        this.sumSquares = b.sumSquares;
        this.sumSquaredDeviations = b.sumSquaredDeviations;
        this.startTime = Objects.requireNonNull(b.startTime, "startTime must not be null");
        this.endTime = Objects.requireNonNull(b.endTime, "endTime must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getCount() {
        return count;
    }

    public double getSum() {
        return sum;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getAvg() {
        return avg;
    }

    public double getLast() {
        return last;
    }

    public double getP50() {
        return p50;
    }

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    /**
     * @return Σv² over the batch
     */
    public double getSumSquares() {
        return sumSquares;
    }

    /**
     * @return Σ(v − avg)² over the batch
     */
    public double getSumSquaredDeviations() {
        return sumSquaredDeviations;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    /**
     * Fluent builder for {@link Aggregation}. {@code avg} is always derived
     * from {@code sum / count}.
     */
    public static class Builder {
        private long count;
        private double sum;
        private double min;
        private double max;
        private double last;
        private double p50;
        private double p95;
        private double p99;
        private double sumSquares;
        private double sumSquaredDeviations;
        private Instant startTime;
        private Instant endTime;

        public Builder count(long v) {
            this.count = v;
            return this;
        }

        public Builder sum(double v) {
            this.sum = v;
            return this;
        }

        public Builder min(double v) {
            this.min = v;
            return this;
        }

        public Builder max(double v) {
            this.max = v;
            return this;
        }

        public Builder last(double v) {
            this.last = v;
            return this;
        }

        public Builder p50(double v) {
            this.p50 = v;
            return this;
        }

        public Builder p95(double v) {
            this.p95 = v;
            return this;
        }

        public Builder p99(double v) {
            this.p99 = v;
            return this;
        }

        public Builder sumSquares(double v) {
            this.sumSquares = v;
            return this;
        }

        public Builder sumSquaredDeviations(double v) {
            this.sumSquaredDeviations = v;
            return this;
        }

        public Builder startTime(Instant v) {
            this.startTime = v;
            return this;
        }

        public Builder endTime(Instant v) {
            this.endTime = v;
            return this;
        }

        /**
         * @return a new {@link Aggregation}
         * @throws IllegalArgumentException if {@code count} is not positive
         * @throws NullPointerException     if a timestamp is missing
         */
        public Aggregation build() {
            return new Aggregation(this);
        }
    }

    @Override
    public String toString() {
        return "Aggregation{" +
                "count=" + count +
                ", sum=" + sum +
                ", min=" + min +
                ", max=" + max +
                ", avg=" + avg +
                ", last=" + last +
                ", p50=" + p50 +
                ", p95=" + p95 +
                ", p99=" + p99 +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                '}';
    }
}
