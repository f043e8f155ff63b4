package com.realtimeanalytics.core.engine;

import com.realtimeanalytics.core.aggregation.Aggregator;
import com.realtimeanalytics.core.baseline.BaselineStats;
import com.realtimeanalytics.core.baseline.BaselineStatsStore;
import com.realtimeanalytics.core.buffer.MovingAverageTracker;
import com.realtimeanalytics.core.buffer.SampleBuffer;
import com.realtimeanalytics.core.config.EngineConfig;
import com.realtimeanalytics.core.detection.AnomalyDetector;
import com.realtimeanalytics.core.detection.BaselineAnomalyDetector;
import com.realtimeanalytics.core.event.AggregationEvent;
import com.realtimeanalytics.core.event.EngineError;
import com.realtimeanalytics.core.event.EventChannel;
import com.realtimeanalytics.core.model.AnomalyEvent;
import com.realtimeanalytics.core.model.Granularity;
import com.realtimeanalytics.core.model.HistoryRow;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.Sample;
import com.realtimeanalytics.core.model.TimeRange;
import com.realtimeanalytics.core.storage.RetryingStorageBackend;
import com.realtimeanalytics.core.storage.StorageBackend;
import com.realtimeanalytics.core.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Embedded real-time metrics engine.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   recordMetric (caller thread, in-memory only)
 *     → SampleBuffer          (per-key append)
 *     → AnomalyDetector       (z-score against baseline → onAnomaly)
 *     → MovingAverageTracker  (windowed averages)
 *
 *   aggregator thread (every aggregationInterval, or on buffer overflow)
 *     → Aggregator: drain → summarize → persist → fold baseline → onAggregation
 * </pre>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} loads baselines from storage, starts the aggregation and
 * retention timers and only then accepts writes. {@link #shutdown()} stops
 * accepting writes, cancels the timers, waits for the running pass, flushes
 * every buffered sample exactly once and closes storage. Both are safe to
 * call more than once.
 * </p>
 *
 * <h3>Failure model</h3>
 * <p>
 * {@code recordMetric} never throws: invalid names, tags and non-finite
 * values, and writes while the engine is not running, are dropped.
 * Storage failures in the background are retried by
 * {@link RetryingStorageBackend} and then published via {@link #onError}.
 * {@link #getMetricHistory} lets storage errors reach its caller.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsEngine.class);

    private final EngineConfig config;
    private final Clock clock;
    private final StorageBackend storage;
    private final EventChannel events = new EventChannel();
    private final SampleBuffer buffer;
    private final MovingAverageTracker movingAverages;
    private final BaselineStatsStore baselines = new BaselineStatsStore();
    private final AnomalyDetector detector;
    private final Aggregator aggregator;
    private final ScheduledExecutorService scheduler;

    /** Write lock is held only to flip into {@link EngineState#CLOSING}. */
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private volatile EngineState state = EngineState.NEW;
    private final LongAdder droppedSamples = new LongAdder();

    public AnalyticsEngine(EngineConfig config, StorageBackend storage) {
        this(config, storage, Clock.systemUTC());
    }

    /**
     * @param config  validated configuration
     * @param storage storage backend; wrapped with the configured retry policy
     * @param clock   source of timestamps for samples and window eviction
     */
    public AnalyticsEngine(EngineConfig config, StorageBackend storage, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.storage = new RetryingStorageBackend(
                Objects.requireNonNull(storage, "storage must not be null"),
                config.getRetryMaxAttempts(), config.getRetryInitialBackoff(), config.getRetryMaxBackoff());
        this.buffer = new SampleBuffer(config.getBufferOverflowThreshold());
        this.movingAverages = new MovingAverageTracker(config.getWindowSizesSeconds());
        this.detector = new BaselineAnomalyDetector(baselines, config.getAnomalyThreshold(),
                config.getMinimumSamples());
        this.aggregator = new Aggregator(buffer, baselines, this.storage, events, clock);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "analytics-aggregator");
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Load baselines, start the timers and begin accepting writes.
     *
     * <p>
     * A baseline load failure is published on the error channel and the
     * engine starts with empty baselines.
     * </p>
     *
     * @throws IllegalStateException if the engine was already started or shut
     *                               down
     */
    public synchronized void start() {
        if (state != EngineState.NEW) {
            throw new IllegalStateException("Engine cannot be started from state " + state);
        }
        state = EngineState.STARTING;
        LOG.info("Starting Analytics Engine with config: {}", config);

        loadBaselines();

        long intervalMs = config.getAggregationInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::runAggregationPass, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        long retentionMs = config.getRetentionCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::runRetention, retentionMs, retentionMs, TimeUnit.MILLISECONDS);

        state = EngineState.RUNNING;
        LOG.info("Analytics Engine initialized");
    }

    /**
     * Stop accepting writes, flush every buffered sample and close storage.
     * Returns once the drain is complete; later calls return immediately.
     */
    public synchronized void shutdown() {
        if (state == EngineState.CLOSED) {
            LOG.debug("Analytics Engine already shut down");
            return;
        }
        LOG.info("Shutting down Analytics Engine...");

        lifecycle.writeLock().lock();
        try {
            state = EngineState.CLOSING;
        } finally {
            lifecycle.writeLock().unlock();
        }

        scheduler.shutdown();
        long timeoutMs = config.getShutdownTimeout().toMillis();
        try {
            if (!scheduler.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("Aggregation pass did not finish within {} ms, interrupting", timeoutMs);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the aggregation pass, interrupting it");
            scheduler.shutdownNow();
        }

        int flushed = aggregator.aggregateAll();

        try {
            storage.close();
        } catch (StorageException e) {
            LOG.error("Failed to close storage", e);
            events.publishError(new EngineError(EngineError.Kind.PERSISTENCE, null,
                    "Failed to close storage: " + e.getMessage(), e, clock.instant()));
        }

        state = EngineState.CLOSED;
        LOG.info("Analytics Engine shut down, flushed {} metric(s)", flushed);
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---------------------------------------------------------------
    // Hot path
    // ---------------------------------------------------------------

    public void recordMetric(String name, double value) {
        recordMetric(name, value, Collections.emptyMap(), null);
    }

    public void recordMetric(String name, double value, Map<String, String> tags) {
        recordMetric(name, value, tags, null);
    }

    /**
     * Record one measurement. Never throws; invalid input and writes while
     * the engine is not running are dropped.
     *
     * @param name      metric name
     * @param value     measured value; must be finite to be kept
     * @param tags      tags, may be {@code null}
     * @param timestamp measurement time, {@code null} for the engine clock
     */
    public void recordMetric(String name, double value, Map<String, String> tags, Instant timestamp) {
        lifecycle.readLock().lock();
        try {
            if (state != EngineState.RUNNING) {
                droppedSamples.increment();
                LOG.trace("Engine is {} – dropping {}={}", state, name, value);
                return;
            }
            if (!Double.isFinite(value)) {
                droppedSamples.increment();
                LOG.trace("Non-finite value for {} – skipping", name);
                return;
            }
            MetricKey key;
            try {
                key = MetricKey.of(name, tags);
            } catch (IllegalArgumentException e) {
                droppedSamples.increment();
                LOG.trace("Invalid metric '{}' – skipping: {}", name, e.getMessage());
                return;
            }
            Instant ts = timestamp != null ? timestamp : clock.instant();

            boolean overflow = buffer.append(key, new Sample(value, ts));

            Optional<AnomalyEvent> anomaly = detector.detect(key, value, ts);
            anomaly.ifPresent(events::publishAnomaly);

            movingAverages.update(key, value, ts);

            if (overflow) {
                scheduleEarlyAggregation(key);
            }
        } catch (RuntimeException e) {
            LOG.error("Error recording metric {}", name, e);
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * Current moving averages of every series.
     *
     * @return canonical key → (window seconds → average); windows without
     *         data are absent
     */
    public Map<String, Map<Integer, Double>> getCurrentMetrics() {
        return movingAverages.snapshot(clock.instant());
    }

    /**
     * @param name              metric name
     * @param tags              tags, may be {@code null}
     * @param windowSizeSeconds a configured window size
     * @return the average, or empty when the window holds no data
     * @throws IllegalArgumentException if the window size is not configured
     */
    public OptionalDouble currentAverage(String name, Map<String, String> tags, int windowSizeSeconds) {
        return movingAverages.currentAverage(MetricKey.of(name, tags), windowSizeSeconds, clock.instant());
    }

    /**
     * @param name metric name
     * @param tags tags, may be {@code null}
     * @return the series baseline, or empty if it was never aggregated
     */
    public Optional<BaselineStats> getBaseline(String name, Map<String, String> tags) {
        return baselines.get(MetricKey.of(name, tags));
    }

    public List<HistoryRow> getMetricHistory(String name, Map<String, String> tags, TimeRange range) {
        return getMetricHistory(name, tags, range, Granularity.MINUTE);
    }

    /**
     * Read aggregate history from storage.
     *
     * @param name        metric name
     * @param tags        tag filter, may be {@code null}
     * @param range       time range on aggregation end time
     * @param granularity bucket width
     * @return rows sorted by bucket
     * @throws StorageException      if storage fails
     * @throws IllegalStateException if the engine is shut down
     */
    public List<HistoryRow> getMetricHistory(String name, Map<String, String> tags, TimeRange range,
            Granularity granularity) {
        if (state == EngineState.CLOSED) {
            throw new IllegalStateException("Engine is shut down");
        }
        return storage.queryHistory(name, tags, range, granularity);
    }

    /**
     * Aggregate every buffered series now, on the calling thread.
     *
     * @return number of series aggregated
     * @throws IllegalStateException if the engine is shut down
     */
    public int flush() {
        if (state == EngineState.CLOSED) {
            throw new IllegalStateException("Engine is shut down");
        }
        return aggregator.aggregateAll();
    }

    // ---------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------

    public void onAnomaly(Consumer<AnomalyEvent> listener) {
        events.onAnomaly(listener);
    }

    public void onAggregation(Consumer<AggregationEvent> listener) {
        events.onAggregation(listener);
    }

    public void onError(Consumer<EngineError> listener) {
        events.onError(listener);
    }

    /**
     * Unsubscribe a listener registered through any of the {@code on*} methods.
     *
     * @param listener the registered listener
     * @return {@code true} if it was registered
     */
    public boolean removeListener(Consumer<?> listener) {
        return events.remove(listener);
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    public EngineState getState() {
        return state;
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * @return samples dropped because they were invalid or arrived while the
     *         engine was not running
     */
    public long getDroppedSamples() {
        return droppedSamples.sum();
    }

    /**
     * @return samples waiting for the next aggregation, across all series
     */
    public long getBufferedSamples() {
        return buffer.totalSize();
    }

    // ---------------------------------------------------------------
    // Background tasks
    // ---------------------------------------------------------------

    private void loadBaselines() {
        Instant since = clock.instant().minus(config.getBaselineLookback());
        try {
            baselines.load(storage, since);
        } catch (StorageException e) {
            LOG.error("Failed to load baseline stats, starting with empty baselines", e);
            events.publishError(new EngineError(EngineError.Kind.BASELINE_LOAD, null,
                    "Failed to load baseline stats: " + e.getMessage(), e, clock.instant()));
        }
    }

    private void scheduleEarlyAggregation(MetricKey key) {
        try {
            scheduler.execute(() -> runAggregation(key));
        } catch (RejectedExecutionException e) {
            // shutdown's final pass drains the key
            LOG.debug("Early aggregation of {} rejected, leaving it to the final pass", key);
        }
    }

    private void runAggregation(MetricKey key) {
        try {
            aggregator.aggregate(key);
        } catch (RuntimeException e) {
            LOG.error("Error aggregating metric {}", key, e);
            events.publishError(new EngineError(EngineError.Kind.AGGREGATION, key,
                    "Aggregation failed: " + e.getMessage(), e, clock.instant()));
        }
    }

    private void runAggregationPass() {
        try {
            int aggregated = aggregator.aggregateAll();
            if (aggregated > 0) {
                LOG.debug("Aggregation pass covered {} metric(s)", aggregated);
            }
        } catch (RuntimeException e) {
            // keep the periodic task alive
            LOG.error("Aggregation pass failed", e);
        }
    }

    private void runRetention() {
        Instant cutoff = clock.instant().minus(config.getRetention());
        try {
            int purged = storage.purgeBefore(cutoff);
            if (purged > 0) {
                LOG.info("Purged {} aggregation(s) older than {}", purged, cutoff);
            }
        } catch (StorageException e) {
            LOG.error("Error cleaning up old data", e);
            events.publishError(new EngineError(EngineError.Kind.RETENTION, null,
                    "Retention purge failed: " + e.getMessage(), e, clock.instant()));
        }
    }
}
