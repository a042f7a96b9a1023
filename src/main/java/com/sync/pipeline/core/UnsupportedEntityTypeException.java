package com.sync.pipeline.core;

/**
 * Thrown when a stage component is asked to handle an entity type or action
 * it does not implement. Never retried.
 */
public class UnsupportedEntityTypeException extends RuntimeException {

    public UnsupportedEntityTypeException(String message) {
        super(message);
    }

    public UnsupportedEntityTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
