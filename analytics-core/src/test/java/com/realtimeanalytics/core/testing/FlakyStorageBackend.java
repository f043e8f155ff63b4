package com.realtimeanalytics.core.testing;

import com.realtimeanalytics.core.baseline.BaselineStats;
import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.storage.InMemoryStorageBackend;
import com.realtimeanalytics.core.storage.StorageException;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory backend that fails the next {@code n} calls of each operation.
 */
public class FlakyStorageBackend extends InMemoryStorageBackend {

    private final AtomicInteger persistFailures = new AtomicInteger();
    private final AtomicInteger loadFailures = new AtomicInteger();
    private final AtomicInteger persistCalls = new AtomicInteger();
    private final AtomicInteger loadCalls = new AtomicInteger();

    public void failNextPersists(int n) {
        persistFailures.set(n);
    }

    public void failNextLoads(int n) {
        loadFailures.set(n);
    }

    public void failAlways() {
        persistFailures.set(Integer.MAX_VALUE);
        loadFailures.set(Integer.MAX_VALUE);
    }

    @Override
    public void persistAggregation(MetricKey key, Aggregation aggregation) {
        persistCalls.incrementAndGet();
        if (persistFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new StorageException("simulated persist failure");
        }
        super.persistAggregation(key, aggregation);
    }

    @Override
    public Map<MetricKey, BaselineStats> loadBaselineStats(Instant since) {
        loadCalls.incrementAndGet();
        if (loadFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new StorageException("simulated load failure");
        }
        return super.loadBaselineStats(since);
    }

    public int getPersistCalls() {
        return persistCalls.get();
    }

    public int getLoadCalls() {
        return loadCalls.get();
    }
}
