package com.realtimeanalytics.core.storage;

import com.realtimeanalytics.core.aggregation.AggregationCalculator;
import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.Sample;
import com.realtimeanalytics.core.testing.FlakyStorageBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RetryingStorageBackend}.
 */
class RetryingStorageBackendTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final MetricKey KEY = MetricKey.of("cpu");
    private static final Aggregation AGG = AggregationCalculator.summarize(List.of(new Sample(1, T0)));

    private FlakyStorageBackend delegate;
    private RetryingStorageBackend retrying;

    @BeforeEach
    void setUp() {
        delegate = new FlakyStorageBackend();
        retrying = new RetryingStorageBackend(delegate, 3, Duration.ofMillis(1), Duration.ofMillis(5));
    }

    @Test
    @DisplayName("Should succeed after transient failures")
    void shouldRetryTransientFailure() {
        delegate.failNextPersists(2);

        retrying.persistAggregation(KEY, AGG);

        assertThat(delegate.getPersistCalls()).isEqualTo(3);
        assertThat(delegate.getAggregations(KEY)).containsExactly(AGG);
    }

    @Test
    @DisplayName("Should give up after the configured number of attempts")
    void shouldGiveUpAfterMaxAttempts() {
        delegate.failAlways();

        assertThatThrownBy(() -> retrying.persistAggregation(KEY, AGG))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("simulated persist failure");
        assertThat(delegate.getPersistCalls()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should retry baseline loads")
    void shouldRetryLoads() {
        delegate.persistAggregation(KEY, AGG);
        delegate.failNextLoads(1);

        assertThat(retrying.loadBaselineStats(T0)).containsKey(KEY);
        assertThat(delegate.getLoadCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep backoff inside the configured bounds")
    void shouldBoundBackoff() {
        RetryingStorageBackend backend =
                new RetryingStorageBackend(delegate, 10, Duration.ofMillis(100), Duration.ofMillis(1000));

        assertThat(backend.backoffMs(1)).isBetween(100L, 199L);
        assertThat(backend.backoffMs(2)).isBetween(200L, 399L);
        assertThat(backend.backoffMs(4)).isBetween(800L, 1000L);
        assertThat(backend.backoffMs(5)).isEqualTo(1000L);
        assertThat(backend.backoffMs(30)).isEqualTo(1000L);
    }

    @Test
    @DisplayName("Should reject fewer than one attempt")
    void shouldRejectInvalidAttempts() {
        assertThatThrownBy(() -> new RetryingStorageBackend(delegate, 0, Duration.ofMillis(1), Duration.ofMillis(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
