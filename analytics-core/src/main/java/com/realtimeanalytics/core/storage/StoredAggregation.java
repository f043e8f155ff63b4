package com.realtimeanalytics.core.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.MetricKey;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON shape of one line written by {@link JsonLinesStorageBackend}.
 *
 * <p>
 * Plain mutable bean so Jackson can bind it without annotations on the
 * immutable domain types.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoredAggregation {

    private String metric;
    private Map<String, String> tags = new TreeMap<>();
    private long count;
    private double sum;
    private double min;
    private double max;
    private double avg;
    private double last;
    private double p50;
    private double p95;
    private double p99;
    private double sumSquares;
    private double sumSquaredDeviations;
    private Instant startTime;
    private Instant endTime;

    /** No-arg constructor required by Jackson. */
    public StoredAggregation() {
    }

    static StoredAggregation from(MetricKey key, Aggregation aggregation) {
        StoredAggregation stored = new StoredAggregation();
        stored.metric = key.getName();
        stored.tags = new TreeMap<>(key.getTags());
        stored.count = aggregation.getCount();
        stored.sum = aggregation.getSum();
        stored.min = aggregation.getMin();
        stored.max = aggregation.getMax();
        stored.avg = aggregation.getAvg();
        stored.last = aggregation.getLast();
        stored.p50 = aggregation.getP50();
        stored.p95 = aggregation.getP95();
        stored.p99 = aggregation.getP99();
        stored.sumSquares = aggregation.getSumSquares();
        stored.sumSquaredDeviations = aggregation.getSumSquaredDeviations();
        stored.startTime = aggregation.getStartTime();
        stored.endTime = aggregation.getEndTime();
        return stored;
    }

    AggregationRecord toRecord() {
        Aggregation aggregation = Aggregation.builder()
                .count(count)
                .sum(sum)
                .min(min)
                .max(max)
                .last(last)
                .p50(p50)
                .p95(p95)
                .p99(p99)
                .sumSquares(sumSquares)
                .sumSquaredDeviations(sumSquaredDeviations)
                .startTime(startTime)
                .endTime(endTime)
                .build();
        return new AggregationRecord(MetricKey.of(metric, tags), aggregation);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public void setTags(Map<String, String> tags) {
        this.tags = tags != null ? new TreeMap<>(tags) : new TreeMap<>();
    }

    public long getCount() {
        return count;
    }

    public void setCount(long count) {
        this.count = count;
    }

    public double getSum() {
        return sum;
    }

    public void setSum(double sum) {
        this.sum = sum;
    }

    public double getMin() {
        return min;
    }

    public void setMin(double min) {
        this.min = min;
    }

    public double getMax() {
        return max;
    }

    public void setMax(double max) {
        this.max = max;
    }

    /**
     * Written for readers of the file; recomputed from {@code sum / count} on
     * load.
     *
     * @return average
     */
    public double getAvg() {
        return avg;
    }

    public void setAvg(double avg) {
        this.avg = avg;
    }

    public double getLast() {
        return last;
    }

    public void setLast(double last) {
        this.last = last;
    }

    public double getP50() {
        return p50;
    }

    public void setP50(double p50) {
        this.p50 = p50;
    }

    public double getP95() {
        return p95;
    }

    public void setP95(double p95) {
        this.p95 = p95;
    }

    public double getP99() {
        return p99;
    }

    public void setP99(double p99) {
        this.p99 = p99;
    }

    public double getSumSquares() {
        return sumSquares;
    }

    public void setSumSquares(double sumSquares) {
        this.sumSquares = sumSquares;
    }

    public double getSumSquaredDeviations() {
        return sumSquaredDeviations;
    }

    public void setSumSquaredDeviations(double sumSquaredDeviations) {
        this.sumSquaredDeviations = sumSquaredDeviations;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }
}
