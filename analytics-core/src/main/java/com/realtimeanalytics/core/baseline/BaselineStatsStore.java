package com.realtimeanalytics.core.baseline;

import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Cache of {@link BaselineStats} per series.
 *
 * <p>
 * Entries are immutable values swapped atomically, so a reader such as the
 * anomaly detector always sees a complete baseline, either before or after a
 * fold, without taking any lock.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineStatsStore {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineStatsStore.class);

    private final ConcurrentMap<MetricKey, BaselineStats> baselines = new ConcurrentHashMap<>();

    /**
     * Rehydrate baselines from storage, replacing any cached entry of the same
     * key.
     *
     * @param storage storage to read from
     * @param since   only aggregates ending at or after this instant count
     * @return number of series loaded
     * @throws com.realtimeanalytics.core.storage.StorageException if the
     *                                                             read fails
     */
    public int load(StorageBackend storage, Instant since) {
        Objects.requireNonNull(storage, "storage must not be null");
        Map<MetricKey, BaselineStats> loaded = storage.loadBaselineStats(since);
        baselines.putAll(loaded);
        LOG.info("Loaded baseline stats for {} metric(s)", loaded.size());
        return loaded.size();
    }

    /**
     * @param key series key
     * @return the baseline, or empty if the series has never been aggregated
     */
    public Optional<BaselineStats> get(MetricKey key) {
        return Optional.ofNullable(baselines.get(key));
    }

    /**
     * Replace the baseline of a series.
     *
     * @param key   series key
     * @param stats new baseline
     */
    public void upsert(MetricKey key, BaselineStats stats) {
        baselines.put(key, Objects.requireNonNull(stats, "stats must not be null"));
    }

    /**
     * Atomically replace the baseline of a series with a function of its
     * current value ({@link BaselineStats#EMPTY} when absent).
     *
     * @param key    series key
     * @param update update function
     * @return the new baseline
     */
    public BaselineStats update(MetricKey key, UnaryOperator<BaselineStats> update) {
        return baselines.compute(key, (k, current) ->
                update.apply(current != null ? current : BaselineStats.EMPTY));
    }

    /**
     * @return immutable snapshot of every cached baseline
     */
    public Map<MetricKey, BaselineStats> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(baselines));
    }

    public int size() {
        return baselines.size();
    }
}
