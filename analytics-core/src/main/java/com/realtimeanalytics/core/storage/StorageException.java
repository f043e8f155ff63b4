package com.realtimeanalytics.core.storage;

/**
 * Failure reported by a {@link StorageBackend}.
 *
 * @since 1.0.0
 */
public class StorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
