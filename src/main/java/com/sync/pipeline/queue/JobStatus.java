package com.sync.pipeline.queue;

/**
 * Lifecycle of a queued job: {@code PENDING -> PROCESSING -> COMPLETED | FAILED}.
 * A retryable failure re-enters {@code PENDING} until attempts are exhausted.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
