/**
 * Baseline statistics: the immutable
 * {@link com.realtimeanalytics.core.baseline.BaselineStats} value and the
 * per-engine {@link com.realtimeanalytics.core.baseline.BaselineStatsStore}.
 *
 * @since 1.0.0
 */
package com.realtimeanalytics.core.baseline;
