/**
 * Value types shared by every stage of the analytics engine.
 *
 * <ul>
 * <li>{@link com.realtimeanalytics.core.model.MetricKey} — series identity,
 * encoded by {@link com.realtimeanalytics.core.model.MetricKeyCodec}</li>
 * <li>{@link com.realtimeanalytics.core.model.Sample} — one recorded
 * measurement</li>
 * <li>{@link com.realtimeanalytics.core.model.Aggregation} — summary of a
 * drained batch</li>
 * <li>{@link com.realtimeanalytics.core.model.AnomalyEvent} — notification for
 * a deviating value</li>
 * <li>{@link com.realtimeanalytics.core.model.HistoryRow} — bucketed history
 * returned by queries</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.realtimeanalytics.core.model;
