package com.realtimeanalytics.core.storage;

import com.realtimeanalytics.core.baseline.BaselineStats;
import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.Granularity;
import com.realtimeanalytics.core.model.HistoryRow;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Decorator that retries writes, baseline loads and purges with capped
 * exponential backoff.
 *
 * <p>
 * The n-th retry waits a random time in {@code [base, 2 × base)} where
 * {@code base = initialBackoff × 2^(n−1)}, capped at {@code maxBackoff}. Only
 * {@link StorageException}s are retried; after {@code maxAttempts} the last
 * one is rethrown. History queries are passed through untouched so their
 * callers see storage errors immediately.
 * </p>
 *
 * @since 1.0.0
 */
public class RetryingStorageBackend implements StorageBackend {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingStorageBackend.class);

    private final StorageBackend delegate;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    /**
     * @param delegate       backend to protect
     * @param maxAttempts    total attempts including the first; at least 1
     * @param initialBackoff wait before the first retry
     * @param maxBackoff     upper bound of any single wait
     */
    public RetryingStorageBackend(StorageBackend delegate, int maxAttempts, Duration initialBackoff,
            Duration maxBackoff) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = Math.max(1, initialBackoff.toMillis());
        this.maxBackoffMs = Math.max(initialBackoffMs, maxBackoff.toMillis());
    }

    @Override
    public void persistAggregation(MetricKey key, Aggregation aggregation) {
        withRetry("persist " + key, () -> {
            delegate.persistAggregation(key, aggregation);
            return null;
        });
    }

    @Override
    public Map<MetricKey, BaselineStats> loadBaselineStats(Instant since) {
        return withRetry("load baseline stats", () -> delegate.loadBaselineStats(since));
    }

    @Override
    public List<HistoryRow> queryHistory(String metricName, Map<String, String> tags, TimeRange range,
            Granularity granularity) {
        return delegate.queryHistory(metricName, tags, range, granularity);
    }

    @Override
    public int purgeBefore(Instant cutoff) {
        return withRetry("purge before " + cutoff, () -> delegate.purgeBefore(cutoff));
    }

    @Override
    public void close() {
        delegate.close();
    }

    public StorageBackend getDelegate() {
        return delegate;
    }

    private <T> T withRetry(String operation, Supplier<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (StorageException ex) {
                if (attempt >= maxAttempts) {
                    LOG.error("Storage operation '{}' failed after {} attempt(s)", operation, attempt, ex);
                    throw ex;
                }
                long backoffMs = backoffMs(attempt);
                LOG.warn("Storage operation '{}' failed ({}). Retrying attempt {}/{} after {} ms",
                        operation, ex.getMessage(), attempt + 1, maxAttempts, backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StorageException("Interrupted while retrying '" + operation + "'", ex);
                }
                attempt++;
            }
        }
    }

    long backoffMs(int attempt) {
        long base = initialBackoffMs << Math.min(attempt - 1, 20);
        if (base <= 0 || base >= maxBackoffMs) {
            return maxBackoffMs;
        }
        long jitter = ThreadLocalRandom.current().nextLong(base, base * 2);
        return Math.min(jitter, maxBackoffMs);
    }
}
