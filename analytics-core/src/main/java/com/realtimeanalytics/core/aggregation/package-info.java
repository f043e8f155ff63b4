/**
 * Batch aggregation: percentile math, single-pass batch summaries and the
 * drain → persist → fold pipeline run by
 * {@link com.realtimeanalytics.core.aggregation.Aggregator}.
 *
 * @since 1.0.0
 */
package com.realtimeanalytics.core.aggregation;
