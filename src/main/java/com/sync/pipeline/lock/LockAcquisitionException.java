package com.sync.pipeline.lock;

/**
 * Thrown when a lock cannot be acquired within the configured timeout.
 * Treated as a retryable batch failure.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
