package com.realtimeanalytics.core.aggregation;

import com.realtimeanalytics.core.baseline.BaselineStatsStore;
import com.realtimeanalytics.core.buffer.SampleBuffer;
import com.realtimeanalytics.core.event.AggregationEvent;
import com.realtimeanalytics.core.event.EngineError;
import com.realtimeanalytics.core.event.EventChannel;
import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.Sample;
import com.realtimeanalytics.core.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Drains a key's buffer, summarizes it, persists the summary and folds it
 * into the key's baseline.
 *
 * <h3>Ordering</h3>
 * <ol>
 * <li>Drain: the buffer swap is the only step that excludes concurrent
 * appends, and only for that key.</li>
 * <li>Summarize with {@link AggregationCalculator}.</li>
 * <li>Persist. Retries belong to the storage boundary; a final failure of any
 * kind is published as a {@code PERSISTENCE} {@link EngineError} and does not
 * stop the next step.</li>
 * <li>Fold into {@link BaselineStatsStore}.</li>
 * <li>Publish an {@link AggregationEvent}.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    private final SampleBuffer buffer;
    private final BaselineStatsStore baselines;
    private final StorageBackend storage;
    private final EventChannel events;
    private final Clock clock;

    public Aggregator(SampleBuffer buffer, BaselineStatsStore baselines, StorageBackend storage,
            EventChannel events, Clock clock) {
        this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
        this.baselines = Objects.requireNonNull(baselines, "baselines must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Aggregate one key.
     *
     * @param key series key
     * @return the aggregation, or empty if the buffer was empty
     */
    public Optional<Aggregation> aggregate(MetricKey key) {
        List<Sample> drained = buffer.drain(key);
        if (drained.isEmpty()) {
            return Optional.empty();
        }

        Aggregation aggregation = AggregationCalculator.summarize(drained);
        LOG.debug("Aggregated {} sample(s) for {}: {}", aggregation.getCount(), key, aggregation);

        boolean persisted = persist(key, aggregation);
        baselines.update(key, stats -> stats.fold(aggregation));
        events.publishAggregation(new AggregationEvent(key, aggregation, persisted));
        return Optional.of(aggregation);
    }

    /**
     * Aggregate every key with buffered samples. A failure on one key is
     * reported and does not prevent the others from being aggregated.
     *
     * @return number of keys that produced an aggregation
     */
    public int aggregateAll() {
        int aggregated = 0;
        for (MetricKey key : buffer.keys()) {
            try {
                if (aggregate(key).isPresent()) {
                    aggregated++;
                }
            } catch (RuntimeException e) {
                LOG.error("Error aggregating metric {}", key, e);
                events.publishError(new EngineError(EngineError.Kind.AGGREGATION, key,
                        "Aggregation failed: " + e.getMessage(), e, clock.instant()));
            }
        }
        return aggregated;
    }

    private boolean persist(MetricKey key, Aggregation aggregation) {
        try {
            storage.persistAggregation(key, aggregation);
            return true;
        } catch (RuntimeException e) {
            // any backend failure counts as a lost write; the fold still happens
            LOG.error("Failed to persist aggregation for {}", key, e);
            events.publishError(new EngineError(EngineError.Kind.PERSISTENCE, key,
                    "Failed to persist aggregation: " + e.getMessage(), e, clock.instant()));
            return false;
        }
    }
}
