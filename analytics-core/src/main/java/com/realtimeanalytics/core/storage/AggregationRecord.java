package com.realtimeanalytics.core.storage;

import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.MetricKey;

import java.util.Objects;

/**
 * A persisted aggregation together with the series it belongs to.
 *
 * @since 1.0.0
 */
public final class AggregationRecord {

    private final MetricKey key;
    private final Aggregation aggregation;

    public AggregationRecord(MetricKey key, Aggregation aggregation) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.aggregation = Objects.requireNonNull(aggregation, "aggregation must not be null");
    }

    public MetricKey getKey() {
        return key;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    @Override
    public String toString() {
        return "AggregationRecord{key=" + key + ", aggregation=" + aggregation + '}';
    }
}
