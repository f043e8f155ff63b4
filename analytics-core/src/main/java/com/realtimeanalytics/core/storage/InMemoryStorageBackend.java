package com.realtimeanalytics.core.storage;

import com.realtimeanalytics.core.baseline.BaselineStats;
import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.Granularity;
import com.realtimeanalytics.core.model.HistoryRow;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thread-safe, in-process {@link StorageBackend} whose operations always
 * succeed.
 *
 * <p>
 * Intended for tests and for embedders that do not need durability. Closing
 * only marks the instance as closed; the stored aggregations stay readable so
 * a second engine can be started on the same instance to simulate a restart.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryStorageBackend implements StorageBackend {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryStorageBackend.class);

    private final List<AggregationRecord> records = new ArrayList<>();
    private int closeCount;

    @Override
    public synchronized void persistAggregation(MetricKey key, Aggregation aggregation) {
        records.add(new AggregationRecord(key, aggregation));
        LOG.trace("Stored aggregation for {}: {}", key, aggregation);
    }

    @Override
    public synchronized Map<MetricKey, BaselineStats> loadBaselineStats(Instant since) {
        return AggregationHistory.rebuildBaselines(records, since);
    }

    @Override
    public synchronized List<HistoryRow> queryHistory(String metricName, Map<String, String> tags,
            TimeRange range, Granularity granularity) {
        return AggregationHistory.query(records, metricName, tags, range, granularity);
    }

    @Override
    public synchronized int purgeBefore(Instant cutoff) {
        int before = records.size();
        records.removeIf(r -> r.getAggregation().getEndTime().isBefore(cutoff));
        return before - records.size();
    }

    @Override
    public synchronized void close() {
        closeCount++;
    }

    /**
     * @return snapshot of every stored aggregation, oldest first
     */
    public synchronized List<AggregationRecord> getRecords() {
        return List.copyOf(records);
    }

    /**
     * @param key series key
     * @return stored aggregations of one series, oldest first
     */
    public synchronized List<Aggregation> getAggregations(MetricKey key) {
        List<Aggregation> result = new ArrayList<>();
        for (AggregationRecord record : records) {
            if (record.getKey().equals(key)) {
                result.add(record.getAggregation());
            }
        }
        return result;
    }

    public synchronized boolean isClosed() {
        return closeCount > 0;
    }

    /**
     * @return how many times {@link #close()} has been called
     */
    public synchronized int getCloseCount() {
        return closeCount;
    }
}
