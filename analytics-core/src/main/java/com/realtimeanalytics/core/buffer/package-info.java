/**
 * In-memory hot-path state: the per-key
 * {@link com.realtimeanalytics.core.buffer.SampleBuffer} and the
 * {@link com.realtimeanalytics.core.buffer.MovingAverageTracker}.
 *
 * <p>
 * Both structures lock per key and perform no I/O.
 * </p>
 *
 * @since 1.0.0
 */
package com.realtimeanalytics.core.buffer;
