package com.realtimeanalytics.core.buffer;

import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.Sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-key append-only queues of samples awaiting aggregation.
 *
 * <p>
 * Each key owns its own {@link ReentrantLock}, so appends to different keys
 * never contend and appends to the same key serialize only on that key.
 * {@link #drain(MetricKey)} swaps the whole list out under the same lock, so
 * every sample is handed to exactly one drain.
 * </p>
 *
 * <h3>Overflow</h3>
 * <p>
 * Writes are never rejected. When a key's buffer reaches the overflow
 * threshold, {@link #append(MetricKey, Sample)} returns {@code true} once, and
 * the caller is expected to schedule an early drain of that key. The signal is
 * re-armed by the next drain.
 * </p>
 *
 * @since 1.0.0
 */
public class SampleBuffer {

    private final int overflowThreshold;
    private final ConcurrentMap<MetricKey, KeyBuffer> buffers = new ConcurrentHashMap<>();

    /**
     * @param overflowThreshold buffer length that triggers an early drain
     * @throws IllegalArgumentException if the threshold is below 1
     */
    public SampleBuffer(int overflowThreshold) {
        if (overflowThreshold < 1) {
            throw new IllegalArgumentException("overflowThreshold must be >= 1, got: " + overflowThreshold);
        }
        this.overflowThreshold = overflowThreshold;
    }

    /**
     * Append a sample to the key's buffer.
     *
     * @param key    series key
     * @param sample the sample
     * @return {@code true} if the buffer just crossed the overflow threshold
     *         and no early drain has been requested since the last drain
     */
    public boolean append(MetricKey key, Sample sample) {
        KeyBuffer buffer = buffers.computeIfAbsent(key, k -> new KeyBuffer());
        buffer.lock.lock();
        try {
            buffer.samples.add(sample);
            if (buffer.samples.size() >= overflowThreshold && !buffer.drainRequested) {
                buffer.drainRequested = true;
                return true;
            }
            return false;
        } finally {
            buffer.lock.unlock();
        }
    }

    /**
     * Take ownership of every sample currently buffered for {@code key},
     * leaving a fresh empty buffer behind.
     *
     * @param key series key
     * @return drained samples in append order; empty if none
     */
    public List<Sample> drain(MetricKey key) {
        KeyBuffer buffer = buffers.get(key);
        if (buffer == null) {
            return Collections.emptyList();
        }
        buffer.lock.lock();
        try {
            buffer.drainRequested = false;
            if (buffer.samples.isEmpty()) {
                return Collections.emptyList();
            }
            List<Sample> drained = buffer.samples;
            buffer.samples = new ArrayList<>();
            return drained;
        } finally {
            buffer.lock.unlock();
        }
    }

    /**
     * @return snapshot of every key that has ever been buffered
     */
    public Set<MetricKey> keys() {
        return Set.copyOf(buffers.keySet());
    }

    /**
     * @param key series key
     * @return number of samples waiting for {@code key}
     */
    public int size(MetricKey key) {
        KeyBuffer buffer = buffers.get(key);
        if (buffer == null) {
            return 0;
        }
        buffer.lock.lock();
        try {
            return buffer.samples.size();
        } finally {
            buffer.lock.unlock();
        }
    }

    /**
     * @return number of samples waiting across all keys
     */
    public long totalSize() {
        long total = 0;
        for (MetricKey key : buffers.keySet()) {
            total += size(key);
        }
        return total;
    }

    public int getOverflowThreshold() {
        return overflowThreshold;
    }

    private static final class KeyBuffer {
        private final ReentrantLock lock = new ReentrantLock();
        private List<Sample> samples = new ArrayList<>();
        private boolean drainRequested;
    }
}
