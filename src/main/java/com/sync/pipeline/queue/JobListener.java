package com.sync.pipeline.queue;

/**
 * Callback for job lifecycle transitions. All methods default to no-ops.
 */
public interface JobListener {

    default void onCompleted(Job job) {
    }

    /**
     * Called when a job fails terminally: not retryable, or out of attempts.
     */
    default void onFailed(Job job) {
    }

    default void onRetry(Job job, long delayMs) {
    }
}
