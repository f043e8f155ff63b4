/**
 * In-process event channel: anomaly, aggregation and error notifications
 * delivered to registered callbacks.
 *
 * @since 1.0.0
 */
package com.realtimeanalytics.core.event;
