package com.realtimeanalytics.core.detection;

import com.realtimeanalytics.core.model.AnomalyEvent;
import com.realtimeanalytics.core.model.MetricKey;

import java.time.Instant;
import java.util.Optional;

/**
 * Contract for anomaly detectors consulted on every recorded value.
 * <p>
 * Implementations run on the caller's thread inside
 * {@code recordMetric}, so they must be thread-safe, must not block or
 * perform I/O, and must never throw for any input value.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Judge a single value of a series.
     *
     * @param key       the series
     * @param value     the recorded value
     * @param timestamp when it was recorded
     * @return an {@link AnomalyEvent} if the value is anomalous, empty
     *         otherwise or when no decision is possible
     */
    Optional<AnomalyEvent> detect(MetricKey key, double value, Instant timestamp);
}
