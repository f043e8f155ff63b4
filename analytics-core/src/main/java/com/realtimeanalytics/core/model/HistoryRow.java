package com.realtimeanalytics.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One bucket of aggregate history as returned by a history query.
 *
 * @since 1.0.0
 */
public final class HistoryRow {

    private final Instant bucket;
    private final long count;
    private final double sum;
    private final double min;
    private final double max;
    private final double avg;
    private final double last;
    private final double p95;
    private final double p99;

    public HistoryRow(Instant bucket, long count, double sum, double min, double max,
            double last, double p95, double p99) {
        this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
        this.count = count;
        this.sum = sum;
        this.min = min;
        this.max = max;
        this.avg = count > 0 ? sum / count : 0.0;
        this.last = last;
        this.p95 = p95;
        this.p99 = p99;
    }

    public Instant getBucket() {
        return bucket;
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

    public double getP95() {
        return p95;
    }

    public double getP99() {
        return p99;
    }

    @Override
    public String toString() {
        return "HistoryRow{" +
                "bucket=" + bucket +
                ", count=" + count +
                ", avg=" + avg +
                ", min=" + min +
                ", max=" + max +
                ", p95=" + p95 +
                ", p99=" + p99 +
                '}';
    }
}
