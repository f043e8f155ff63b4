/**
 * Online anomaly detection.
 *
 * <p>
 * Detectors implement
 * {@link com.realtimeanalytics.core.detection.AnomalyDetector}; the built-in
 * {@link com.realtimeanalytics.core.detection.BaselineAnomalyDetector} scores
 * each value against the aggregated baseline of its series (mean ± N × σ).
 * </p>
 *
 * @since 1.0.0
 */
package com.realtimeanalytics.core.detection;
