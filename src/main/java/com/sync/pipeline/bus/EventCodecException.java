package com.sync.pipeline.bus;

/**
 * Thrown when an envelope cannot be encoded to or decoded from its wire form.
 */
public class EventCodecException extends RuntimeException {

    public EventCodecException(String message) {
        super(message);
    }

    public EventCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
