package com.sync.pipeline.store;

/**
 * Document store read or write failure. Always retryable through the queue's retry policy.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
