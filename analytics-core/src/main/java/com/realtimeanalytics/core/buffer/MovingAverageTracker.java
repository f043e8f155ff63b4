package com.realtimeanalytics.core.buffer;

import com.realtimeanalytics.core.model.MetricKey;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maintains one {@link MovingAverageWindow} per key and configured window size.
 *
 * <p>
 * Updates for the same key serialize on a per-key lock; different keys never
 * contend. The aggregation path never touches this state.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageTracker {

    private final List<Integer> windowSizesSeconds;
    private final ConcurrentMap<MetricKey, KeyWindows> windows = new ConcurrentHashMap<>();

    /**
     * @param windowSizesSeconds window sizes in seconds; must be non-empty and
     *                           positive
     */
    public MovingAverageTracker(List<Integer> windowSizesSeconds) {
        Objects.requireNonNull(windowSizesSeconds, "windowSizesSeconds must not be null");
        if (windowSizesSeconds.isEmpty()) {
            throw new IllegalArgumentException("At least one window size is required");
        }
        for (Integer size : windowSizesSeconds) {
            if (size == null || size <= 0) {
                throw new IllegalArgumentException("Window size must be positive, got: " + size);
            }
        }
        this.windowSizesSeconds = Collections.unmodifiableList(new ArrayList<>(windowSizesSeconds));
    }

    /**
     * Add a value to every window of {@code key}.
     *
     * @param key       series key
     * @param value     the value
     * @param timestamp sample timestamp
     */
    public void update(MetricKey key, double value, Instant timestamp) {
        KeyWindows keyWindows = windows.computeIfAbsent(key, k -> new KeyWindows(windowSizesSeconds));
        keyWindows.lock.lock();
        try {
            for (MovingAverageWindow window : keyWindows.bySize.values()) {
                window.add(value, timestamp);
            }
        } finally {
            keyWindows.lock.unlock();
        }
    }

    /**
     * Current average of one window.
     *
     * @param key               series key
     * @param windowSizeSeconds a configured window size
     * @param now               reference instant for eviction
     * @return the average, or empty when the window holds no data
     * @throws IllegalArgumentException if the window size is not configured
     */
    public OptionalDouble currentAverage(MetricKey key, int windowSizeSeconds, Instant now) {
        if (!windowSizesSeconds.contains(windowSizeSeconds)) {
            throw new IllegalArgumentException("Window size not configured: " + windowSizeSeconds);
        }
        KeyWindows keyWindows = windows.get(key);
        if (keyWindows == null) {
            return OptionalDouble.empty();
        }
        keyWindows.lock.lock();
        try {
            MovingAverageWindow window = keyWindows.bySize.get(windowSizeSeconds);
            window.evictRelativeTo(now);
            return window.average();
        } finally {
            keyWindows.lock.unlock();
        }
    }

    /**
     * Averages of every non-empty window of every key.
     *
     * @param now reference instant for eviction
     * @return canonical key → (window seconds → average); windows without data
     *         are omitted, keys without any data are omitted
     */
    public Map<String, Map<Integer, Double>> snapshot(Instant now) {
        Map<String, Map<Integer, Double>> result = new TreeMap<>();
        for (Map.Entry<MetricKey, KeyWindows> entry : windows.entrySet()) {
            KeyWindows keyWindows = entry.getValue();
            Map<Integer, Double> averages = new LinkedHashMap<>();
            keyWindows.lock.lock();
            try {
                for (Map.Entry<Integer, MovingAverageWindow> window : keyWindows.bySize.entrySet()) {
                    window.getValue().evictRelativeTo(now);
                    OptionalDouble average = window.getValue().average();
                    if (average.isPresent()) {
                        averages.put(window.getKey(), average.getAsDouble());
                    }
                }
            } finally {
                keyWindows.lock.unlock();
            }
            if (!averages.isEmpty()) {
                result.put(entry.getKey().asString(), Collections.unmodifiableMap(averages));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public List<Integer> getWindowSizesSeconds() {
        return windowSizesSeconds;
    }

    private static final class KeyWindows {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<Integer, MovingAverageWindow> bySize = new LinkedHashMap<>();

        private KeyWindows(List<Integer> sizes) {
            for (Integer size : sizes) {
                bySize.put(size, new MovingAverageWindow(Duration.ofSeconds(size)));
            }
        }
    }
}
