package com.realtimeanalytics.core.event;

import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.MetricKey;

import java.util.Objects;

/**
 * Published after each completed aggregation, whether or not it could be
 * persisted.
 *
 * @since 1.0.0
 */
public final class AggregationEvent {

    private final MetricKey key;
    private final Aggregation aggregation;
    private final boolean persisted;

    public AggregationEvent(MetricKey key, Aggregation aggregation, boolean persisted) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.aggregation = Objects.requireNonNull(aggregation, "aggregation must not be null");
        this.persisted = persisted;
    }

    public MetricKey getKey() {
        return key;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    /**
     * @return {@code false} if storage rejected the aggregation after all retries
     */
    public boolean isPersisted() {
        return persisted;
    }

    @Override
    public String toString() {
        return "AggregationEvent{key=" + key + ", aggregation=" + aggregation + ", persisted=" + persisted + '}';
    }
}
