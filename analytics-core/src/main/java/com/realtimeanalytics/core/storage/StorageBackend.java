package com.realtimeanalytics.core.storage;

import com.realtimeanalytics.core.baseline.BaselineStats;
import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.Granularity;
import com.realtimeanalytics.core.model.HistoryRow;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.TimeRange;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Narrow contract to the long-term metrics store.
 *
 * <p>
 * The engine calls {@link #persistAggregation(MetricKey, Aggregation)} from
 * its aggregation thread only, {@link #loadBaselineStats(Instant)} once at
 * start-up, and {@link #queryHistory} from whichever thread asks for history.
 * Every failure is reported as a {@link StorageException}.
 * </p>
 *
 * @since 1.0.0
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * Store one aggregation of a series.
     *
     * @param key         series the aggregation belongs to
     * @param aggregation the summary
     * @throws StorageException if the write fails
     */
    void persistAggregation(MetricKey key, Aggregation aggregation);

    /**
     * Rebuild baselines from the aggregate history.
     *
     * @param since only aggregations ending at or after this instant count
     * @return baseline per series
     * @throws StorageException if the read fails
     */
    Map<MetricKey, BaselineStats> loadBaselineStats(Instant since);

    /**
     * Read bucketed aggregate history.
     *
     * @param metricName  metric name
     * @param tags        a series matches when its tags contain all of these;
     *                    {@code null} or empty matches every series of the metric
     * @param range       inclusive range on aggregation end time
     * @param granularity bucket width
     * @return rows sorted by bucket, ascending
     * @throws StorageException if the read fails
     */
    List<HistoryRow> queryHistory(String metricName, Map<String, String> tags, TimeRange range,
            Granularity granularity);

    /**
     * Delete aggregations that ended before {@code cutoff}.
     *
     * @param cutoff retention boundary
     * @return number of deleted aggregations
     * @throws StorageException if the delete fails
     */
    default int purgeBefore(Instant cutoff) {
        return 0;
    }

    /**
     * Flush and release resources.
     *
     * @throws StorageException if closing fails
     */
    @Override
    void close();
}
