package com.realtimeanalytics.core.event;

import com.realtimeanalytics.core.model.AnomalyEvent;
import com.realtimeanalytics.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventChannel}.
 */
class EventChannelTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Should deliver events to listeners in registration order")
    void shouldDeliverInOrder() {
        EventChannel channel = new EventChannel();
        List<String> calls = new ArrayList<>();
        channel.onAnomaly(e -> calls.add("first"));
        channel.onAnomaly(e -> calls.add("second"));

        channel.publishAnomaly(anomaly());

        assertThat(calls).containsExactly("first", "second");
    }

    @Test
    @DisplayName("Should keep delivering after a listener throws")
    void shouldIsolateFailingListener() {
        EventChannel channel = new EventChannel();
        List<EngineError> received = new ArrayList<>();
        channel.onError(e -> {
            throw new IllegalStateException("boom");
        });
        channel.onError(received::add);

        EngineError error = new EngineError(EngineError.Kind.PERSISTENCE, null, "failed", null, NOW);
        channel.publishError(error);

        assertThat(received).containsExactly(error);
        assertThat(error.getMetricKey()).isEmpty();
        assertThat(error.getCause()).isEmpty();
    }

    @Test
    @DisplayName("Should stop delivering to a removed listener")
    void shouldRemoveListener() {
        EventChannel channel = new EventChannel();
        List<AnomalyEvent> received = new ArrayList<>();
        Consumer<AnomalyEvent> listener = received::add;
        channel.onAnomaly(listener);

        assertThat(channel.remove(listener)).isTrue();
        channel.publishAnomaly(anomaly());

        assertThat(received).isEmpty();
        assertThat(channel.remove(listener)).isFalse();
    }

    private static AnomalyEvent anomaly() {
        return AnomalyEvent.builder()
                .metric("m")
                .value(1)
                .deviation(4)
                .severity(Severity.MEDIUM)
                .timestamp(NOW)
                .build();
    }
}
