package com.realtimeanalytics.core.storage;

import com.realtimeanalytics.core.baseline.BaselineStats;
import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.Granularity;
import com.realtimeanalytics.core.model.HistoryRow;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.TimeRange;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Baseline and history computations over a list of persisted aggregations,
 * shared by the record-based backends.
 *
 * @since 1.0.0
 */
public final class AggregationHistory {

    private AggregationHistory() {
        // utility class — not instantiable
    }

    /**
     * Fold every aggregation that ended at or after {@code since}, in
     * persistence order.
     *
     * @param records persisted aggregations, oldest first
     * @param since   lower bound on end time; {@code null} includes everything
     * @return baseline per series, in first-seen order
     */
    public static Map<MetricKey, BaselineStats> rebuildBaselines(List<AggregationRecord> records, Instant since) {
        Map<MetricKey, BaselineStats> baselines = new LinkedHashMap<>();
        for (AggregationRecord record : records) {
            Aggregation aggregation = record.getAggregation();
            if (since != null && aggregation.getEndTime().isBefore(since)) {
                continue;
            }
            baselines.merge(record.getKey(), BaselineStats.EMPTY.fold(aggregation),
                    (current, ignored) -> current.fold(aggregation));
        }
        return baselines;
    }

    /**
     * Select and bucket history rows.
     *
     * <p>
     * Rows in the same bucket are merged: counts and sums add up, min and max
     * widen, and {@code last}, {@code p95} and {@code p99} come from the
     * aggregation with the latest end time. {@link Granularity#RAW} never
     * merges: every matching aggregation is its own row, keyed by end time.
     * </p>
     *
     * @param records     persisted aggregations, oldest first
     * @param metricName  metric name to select
     * @param tags        required tags, may be {@code null}
     * @param range       inclusive range on end time
     * @param granularity bucket width
     * @return rows sorted by bucket
     */
    public static List<HistoryRow> query(List<AggregationRecord> records, String metricName,
            Map<String, String> tags, TimeRange range, Granularity granularity) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(range, "range must not be null");
        Objects.requireNonNull(granularity, "granularity must not be null");

        List<HistoryRow> rawRows = new ArrayList<>();
        TreeMap<Instant, Bucket> buckets = new TreeMap<>();
        for (AggregationRecord record : records) {
            Aggregation aggregation = record.getAggregation();
            if (!record.getKey().getName().equals(metricName)
                    || !record.getKey().hasTags(tags)
                    || !range.contains(aggregation.getEndTime())) {
                continue;
            }
            if (granularity == Granularity.RAW) {
                Bucket single = new Bucket(aggregation.getEndTime());
                single.add(aggregation);
                rawRows.add(single.toRow());
                continue;
            }
            Instant bucketStart = granularity.bucketStart(aggregation.getEndTime());
            buckets.computeIfAbsent(bucketStart, Bucket::new).add(aggregation);
        }

        if (granularity == Granularity.RAW) {
            // stable: equal end times keep persistence order
            rawRows.sort(Comparator.comparing(HistoryRow::getBucket));
            return rawRows;
        }
        List<HistoryRow> rows = new ArrayList<>(buckets.size());
        for (Bucket bucket : buckets.values()) {
            rows.add(bucket.toRow());
        }
        return rows;
    }

    private static final class Bucket {
        private final Instant start;
        private long count;
        private double sum;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;
        private Aggregation newest;

        private Bucket(Instant start) {
            this.start = start;
        }

        private void add(Aggregation aggregation) {
            count += aggregation.getCount();
            sum += aggregation.getSum();
            min = Math.min(min, aggregation.getMin());
            max = Math.max(max, aggregation.getMax());
            if (newest == null || !aggregation.getEndTime().isBefore(newest.getEndTime())) {
                newest = aggregation;
            }
        }

        private HistoryRow toRow() {
            return new HistoryRow(start, count, sum, min, max,
                    newest.getLast(), newest.getP95(), newest.getP99());
        }
    }
}
