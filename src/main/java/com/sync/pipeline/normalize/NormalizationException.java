package com.sync.pipeline.normalize;

/**
 * A single raw record could not be normalized. The record is skipped; the batch continues.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
