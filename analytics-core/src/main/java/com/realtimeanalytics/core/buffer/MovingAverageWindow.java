package com.realtimeanalytics.core.buffer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Time-bounded sliding window keeping a running sum of its values.
 *
 * <p>
 * Entries older than the window are evicted lazily, whenever a value is added
 * or {@link #evictBefore(Instant)} is called. On add, "now" is the newest
 * timestamp the window has seen, so a late sample never pushes the window
 * back in time. After eviction every retained entry satisfies
 * {@code now - timestamp <= windowSize}, and {@code sum} equals the sum of the
 * retained values.
 * </p>
 *
 * <p>
 * Not thread-safe; {@link MovingAverageTracker} guards each window with its
 * key's lock.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageWindow {

    private final Duration windowSize;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private double sum;
    private Instant newest;
    /** Set once an entry was appended behind a newer one; eviction then scans. */
    private boolean unordered;

    /**
     * @param windowSize window length; must be positive
     */
    public MovingAverageWindow(Duration windowSize) {
        Objects.requireNonNull(windowSize, "windowSize must not be null");
        if (windowSize.isNegative() || windowSize.isZero()) {
            throw new IllegalArgumentException("windowSize must be positive, got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    /**
     * Add a value and evict everything that fell out of the window relative
     * to the newest timestamp seen so far.
     *
     * <p>
     * A value that is already older than the window is not retained. Values
     * may arrive out of order; eviction still removes every stale entry.
     * </p>
     *
     * @param value     the value
     * @param timestamp its timestamp
     * @return {@code true} if the value was retained
     */
    public boolean add(double value, Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (newest == null || timestamp.isAfter(newest)) {
            newest = timestamp;
        }
        Instant cutoff = newest.minus(windowSize);
        if (timestamp.isBefore(cutoff)) {
            evictBefore(cutoff);
            return false;
        }
        Entry last = entries.peekLast();
        if (last != null && timestamp.isBefore(last.timestamp)) {
            unordered = true;
        }
        entries.addLast(new Entry(value, timestamp));
        sum += value;
        evictBefore(cutoff);
        return true;
    }

    /**
     * Evict entries relative to the given instant.
     *
     * @param now reference instant
     */
    public void evictRelativeTo(Instant now) {
        evictBefore(now.minus(windowSize));
    }

    /**
     * Drop every entry whose timestamp is before {@code cutoff}.
     *
     * @param cutoff oldest timestamp allowed to stay
     */
    public void evictBefore(Instant cutoff) {
        if (unordered) {
            Iterator<Entry> it = entries.iterator();
            while (it.hasNext()) {
                Entry entry = it.next();
                if (entry.timestamp.isBefore(cutoff)) {
                    sum -= entry.value;
                    it.remove();
                }
            }
        } else {
            while (!entries.isEmpty() && entries.peekFirst().timestamp.isBefore(cutoff)) {
                sum -= entries.removeFirst().value;
            }
        }
        if (entries.isEmpty()) {
            // drop accumulated rounding error
            sum = 0.0;
            unordered = false;
        }
    }

    /**
     * @return the average of retained values, or empty when the window holds
     *         no data
     */
    public OptionalDouble average() {
        return entries.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(sum / entries.size());
    }

    public double sum() {
        return sum;
    }

    public int count() {
        return entries.size();
    }

    public Duration getWindowSize() {
        return windowSize;
    }

    private static final class Entry {
        private final double value;
        private final Instant timestamp;

        private Entry(double value, Instant timestamp) {
            this.value = value;
            this.timestamp = timestamp;
        }
    }
}
