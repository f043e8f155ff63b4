package com.realtimeanalytics.core.buffer;

import com.realtimeanalytics.core.model.MetricKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MovingAverageTracker}.
 */
class MovingAverageTrackerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final MetricKey CPU = MetricKey.of("cpu", Map.of("host", "a"));

    private MovingAverageTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new MovingAverageTracker(List.of(60, 300));
    }

    @Test
    @DisplayName("Should track every configured window per key")
    void shouldTrackAllWindows() {
        tracker.update(CPU, 10, T0);
        tracker.update(CPU, 20, T0.plusSeconds(100));

        assertThat(tracker.currentAverage(CPU, 60, T0.plusSeconds(100))).hasValue(20);
        assertThat(tracker.currentAverage(CPU, 300, T0.plusSeconds(100))).hasValue(15);
    }

    @Test
    @DisplayName("Should expire windows as time passes without new data")
    void shouldExpireOnRead() {
        tracker.update(CPU, 10, T0);

        assertThat(tracker.currentAverage(CPU, 60, T0.plusSeconds(120))).isEmpty();
        assertThat(tracker.currentAverage(CPU, 300, T0.plusSeconds(120))).hasValue(10);
    }

    @Test
    @DisplayName("Should omit empty windows and keys from the snapshot")
    void shouldOmitEmptyWindowsInSnapshot() {
        MetricKey mem = MetricKey.of("mem");
        tracker.update(CPU, 10, T0);
        tracker.update(mem, 5, T0.plusSeconds(200));

        Map<String, Map<Integer, Double>> snapshot = tracker.snapshot(T0.plusSeconds(200));

        assertThat(snapshot).containsOnlyKeys("cpu:host:a", "mem:");
        assertThat(snapshot.get("cpu:host:a")).containsOnlyKeys(300).containsEntry(300, 10.0);
        assertThat(snapshot.get("mem:")).containsEntry(60, 5.0).containsEntry(300, 5.0);

        assertThat(tracker.snapshot(T0.plusSeconds(10_000))).isEmpty();
    }

    @Test
    @DisplayName("Should report no data for an unknown key")
    void shouldReturnEmptyForUnknownKey() {
        assertThat(tracker.currentAverage(MetricKey.of("nothing"), 60, T0)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a window size that is not configured")
    void shouldRejectUnknownWindow() {
        assertThatThrownBy(() -> tracker.currentAverage(CPU, 42, T0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("42");
    }
}
