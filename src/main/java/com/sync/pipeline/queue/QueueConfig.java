package com.sync.pipeline.queue;

/**
 * Job queue settings.
 *
 * @param concurrency              maximum jobs in processing at once
 * @param maxAttempts              attempts before a job fails terminally
 * @param backoffBaseMs            first retry delay; doubles with every further attempt
 * @param stalledTimeoutMs         processing time after which a job is failed as stalled
 * @param stalledCheckIntervalMs   how often stalled jobs are looked for
 * @param keepCompleted            completed jobs retained for status queries
 * @param keepFailed               failed jobs retained for status queries
 * @param backlogDegradedThreshold waiting jobs above which health is DEGRADED
 */
public record QueueConfig(int concurrency, int maxAttempts, long backoffBaseMs, long stalledTimeoutMs,
                          long stalledCheckIntervalMs, int keepCompleted, int keepFailed,
                          int backlogDegradedThreshold) {

    public QueueConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (backoffBaseMs < 0) {
            throw new IllegalArgumentException("backoffBaseMs must be >= 0");
        }
        if (stalledTimeoutMs <= 0 || stalledCheckIntervalMs <= 0) {
            throw new IllegalArgumentException("stalled timeout and check interval must be > 0");
        }
        if (keepCompleted < 0 || keepFailed < 0) {
            throw new IllegalArgumentException("retention counts must be >= 0");
        }
    }

    /**
     * Defaults: 5 workers, 3 attempts, 2s exponential backoff, 5 minute stall timeout,
     * keep 100 completed and 500 failed jobs.
     */
    public static QueueConfig defaults() {
        return new QueueConfig(5, 3, 2000, 300_000, 30_000, 100, 500, 1000);
    }

    /**
     * Retry delay after the given failed attempt (1-based).
     */
    public long backoffDelayMs(int failedAttempt) {
        int exponent = Math.max(0, Math.min(failedAttempt - 1, 20));
        return backoffBaseMs * (1L << exponent);
    }
}
