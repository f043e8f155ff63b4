package com.realtimeanalytics.core.detection;

import com.realtimeanalytics.core.baseline.BaselineStats;
import com.realtimeanalytics.core.baseline.BaselineStatsStore;
import com.realtimeanalytics.core.model.AnomalyEvent;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineAnomalyDetector}.
 */
class BaselineAnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");
    private static final MetricKey KEY = MetricKey.of("response_time", Map.of("endpoint", "/api"));

    private BaselineStatsStore baselines;
    private BaselineAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        baselines = new BaselineStatsStore();
        baselines.upsert(KEY, BaselineStats.of(1000, 100, 10));
        detector = new BaselineAnomalyDetector(baselines, 3.0, 30);
    }

    @Test
    @DisplayName("Should NOT fire on values close to the mean")
    void shouldNotFireOnNormalValue() {
        assertThat(detector.detect(KEY, 105, NOW)).isEmpty();
        assertThat(detector.detect(KEY, 129.9, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should fire MEDIUM at exactly the threshold")
    void shouldFireMediumAtThreshold() {
        Optional<AnomalyEvent> event = detector.detect(KEY, 130, NOW);

        assertThat(event).isPresent();
        assertThat(event.get().getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(event.get().getDeviation()).isCloseTo(3.0, within(1e-9));
        assertThat(event.get().getMetric()).isEqualTo("response_time");
        assertThat(event.get().getTags()).containsEntry("endpoint", "/api");
        assertThat(event.get().getValue()).isEqualTo(130);
        assertThat(event.get().getTimestamp()).isEqualTo(NOW);
        assertThat(event.get().getBaselineMean()).isEqualTo(100);
        assertThat(event.get().getBaselineCount()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Should fire on values below the mean as well")
    void shouldFireOnLowValue() {
        Optional<AnomalyEvent> event = detector.detect(KEY, 70, NOW);

        assertThat(event).hasValueSatisfying(e -> assertThat(e.getSeverity()).isEqualTo(Severity.MEDIUM));
    }

    @Test
    @DisplayName("Should fire HIGH at twice the threshold and beyond")
    void shouldFireHigh() {
        assertThat(detector.detect(KEY, 160, NOW))
                .hasValueSatisfying(e -> assertThat(e.getSeverity()).isEqualTo(Severity.HIGH));
        assertThat(detector.detect(KEY, 10_000, NOW))
                .hasValueSatisfying(e -> assertThat(e.getSeverity()).isEqualTo(Severity.HIGH));
    }

    @Test
    @DisplayName("Should NOT fire before the baseline has enough samples")
    void shouldNotFireDuringWarmUp() {
        baselines.upsert(KEY, BaselineStats.of(29, 100, 10));

        assertThat(detector.detect(KEY, 10_000, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire for a series without baseline")
    void shouldNotFireWithoutBaseline() {
        assertThat(detector.detect(MetricKey.of("unknown"), 10_000, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should fire HIGH on any change of a constant series")
    void shouldFireOnConstantSeriesChange() {
        baselines.upsert(KEY, BaselineStats.of(100, 50, 0));

        assertThat(detector.detect(KEY, 50, NOW)).isEmpty();
        Optional<AnomalyEvent> event = detector.detect(KEY, 50.5, NOW);
        assertThat(event).isPresent();
        assertThat(event.get().getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(event.get().getDeviation()).isInfinite();
    }

    @Test
    @DisplayName("Should ignore non-finite values")
    void shouldIgnoreNonFiniteValues() {
        assertThat(detector.detect(KEY, Double.NaN, NOW)).isEmpty();
        assertThat(detector.detect(KEY, Double.POSITIVE_INFINITY, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should classify deviations against the threshold")
    void shouldClassifyDeviation() {
        assertThat(detector.classify(2.99)).isEmpty();
        assertThat(detector.classify(3.0)).contains(Severity.MEDIUM);
        assertThat(detector.classify(5.99)).contains(Severity.MEDIUM);
        assertThat(detector.classify(6.0)).contains(Severity.HIGH);
        assertThat(detector.classify(Double.POSITIVE_INFINITY)).contains(Severity.HIGH);
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new BaselineAnomalyDetector(baselines, 0, 30))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BaselineAnomalyDetector(baselines, 3, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
