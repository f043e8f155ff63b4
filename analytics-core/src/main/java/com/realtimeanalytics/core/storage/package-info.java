/**
 * Boundary to long-term storage.
 *
 * <p>
 * {@link com.realtimeanalytics.core.storage.StorageBackend} is the only
 * contract the engine depends on. Two implementations ship with the engine:
 * {@link com.realtimeanalytics.core.storage.InMemoryStorageBackend} for tests
 * and non-durable embedding, and
 * {@link com.realtimeanalytics.core.storage.JsonLinesStorageBackend} for a
 * single-file durable log. Retries live in the
 * {@link com.realtimeanalytics.core.storage.RetryingStorageBackend}
 * decorator.
 * </p>
 *
 * @since 1.0.0
 */
package com.realtimeanalytics.core.storage;
