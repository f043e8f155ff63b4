/**
 * Public façade of the analytics engine:
 * {@link com.realtimeanalytics.core.engine.AnalyticsEngine} wires the buffer,
 * moving averages, detector, aggregator and storage together and owns the
 * scheduler and lifecycle.
 *
 * @since 1.0.0
 */
package com.realtimeanalytics.core.engine;
