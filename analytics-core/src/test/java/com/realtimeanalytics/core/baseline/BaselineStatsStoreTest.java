package com.realtimeanalytics.core.baseline;

import com.realtimeanalytics.core.aggregation.AggregationCalculator;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.Sample;
import com.realtimeanalytics.core.storage.InMemoryStorageBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BaselineStatsStore}.
 */
class BaselineStatsStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final MetricKey KEY = MetricKey.of("latency");

    @Test
    @DisplayName("Should start a missing baseline from EMPTY on update")
    void shouldUpdateFromEmpty() {
        BaselineStatsStore store = new BaselineStatsStore();

        BaselineStats updated = store.update(KEY,
                stats -> stats.fold(AggregationCalculator.summarize(List.of(new Sample(4, T0)))));

        assertThat(updated.getCount()).isEqualTo(1);
        assertThat(store.get(KEY)).contains(updated);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should load only aggregations inside the lookback")
    void shouldLoadFromStorage() {
        InMemoryStorageBackend storage = new InMemoryStorageBackend();
        storage.persistAggregation(KEY, AggregationCalculator.summarize(List.of(new Sample(1, T0))));
        storage.persistAggregation(KEY, AggregationCalculator.summarize(List.of(
                new Sample(3, T0.plusSeconds(3600)), new Sample(5, T0.plusSeconds(3601)))));
        BaselineStatsStore store = new BaselineStatsStore();

        int loaded = store.load(storage, T0.plusSeconds(60));

        assertThat(loaded).isEqualTo(1);
        assertThat(store.get(KEY)).hasValueSatisfying(stats -> {
            assertThat(stats.getCount()).isEqualTo(2);
            assertThat(stats.getMean()).isEqualTo(4);
        });
    }

    @Test
    @DisplayName("Should return empty for a series that was never aggregated")
    void shouldReturnEmptyForUnknownKey() {
        assertThat(new BaselineStatsStore().get(KEY)).isEmpty();
    }
}
