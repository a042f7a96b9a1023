package com.sync.pipeline.config;

import com.sync.pipeline.lock.LockConfig;
import com.sync.pipeline.queue.QueueConfig;

import java.time.Duration;

/**
 * Settings of the sync pipeline.
 * Queue, paging, context loading, aggregation and lock settings in one immutable object.
 */
public class PipelineOptions {

    public static final int DEFAULT_CONCURRENCY = 5;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BACKOFF_BASE_MS = 2000;
    public static final long DEFAULT_STALLED_TIMEOUT_MS = 300_000;
    public static final long DEFAULT_STALLED_CHECK_INTERVAL_MS = 30_000;
    public static final int DEFAULT_KEEP_COMPLETED = 100;
    public static final int DEFAULT_KEEP_FAILED = 500;
    public static final int DEFAULT_BACKLOG_DEGRADED_THRESHOLD = 1000;
    public static final int DEFAULT_FETCH_PAGE_SIZE = 500;
    public static final long DEFAULT_SLOW_QUERY_THRESHOLD_MS = 100;
    public static final long DEFAULT_CONTEXT_LOAD_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_AGGREGATION_TTL_MINUTES = 30;
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 5000;

    private final int concurrency;
    private final int maxAttempts;
    private final long backoffBaseMs;
    private final long stalledTimeoutMs;
    private final long stalledCheckIntervalMs;
    private final int keepCompleted;
    private final int keepFailed;
    private final int backlogDegradedThreshold;
    private final int fetchPageSize;
    private final long slowQueryThresholdMs;
    private final long contextLoadTimeoutMs;
    private final long aggregationTtlMinutes;
    private final long lockTimeoutMs;

    private PipelineOptions(Builder builder) {
        this.concurrency = builder.concurrency;
        this.maxAttempts = builder.maxAttempts;
        this.backoffBaseMs = builder.backoffBaseMs;
        this.stalledTimeoutMs = builder.stalledTimeoutMs;
        this.stalledCheckIntervalMs = builder.stalledCheckIntervalMs;
        this.keepCompleted = builder.keepCompleted;
        this.keepFailed = builder.keepFailed;
        this.backlogDegradedThreshold = builder.backlogDegradedThreshold;
        this.fetchPageSize = builder.fetchPageSize;
        this.slowQueryThresholdMs = builder.slowQueryThresholdMs;
        this.contextLoadTimeoutMs = builder.contextLoadTimeoutMs;
        this.aggregationTtlMinutes = builder.aggregationTtlMinutes;
        this.lockTimeoutMs = builder.lockTimeoutMs;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public long getStalledTimeoutMs() {
        return stalledTimeoutMs;
    }

    public long getStalledCheckIntervalMs() {
        return stalledCheckIntervalMs;
    }

    public int getKeepCompleted() {
        return keepCompleted;
    }

    public int getKeepFailed() {
        return keepFailed;
    }

    public int getBacklogDegradedThreshold() {
        return backlogDegradedThreshold;
    }

    public int getFetchPageSize() {
        return fetchPageSize;
    }

    public long getSlowQueryThresholdMs() {
        return slowQueryThresholdMs;
    }

    public long getContextLoadTimeoutMs() {
        return contextLoadTimeoutMs;
    }

    public Duration getAggregationTtl() {
        return Duration.ofMinutes(aggregationTtlMinutes);
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public QueueConfig toQueueConfig() {
        return new QueueConfig(concurrency, maxAttempts, backoffBaseMs, stalledTimeoutMs, stalledCheckIntervalMs,
                keepCompleted, keepFailed, backlogDegradedThreshold);
    }

    public LockConfig toLockConfig() {
        return new LockConfig(lockTimeoutMs);
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PipelineOptions{" +
                "concurrency=" + concurrency +
                ", maxAttempts=" + maxAttempts +
                ", backoffBaseMs=" + backoffBaseMs +
                ", fetchPageSize=" + fetchPageSize +
                ", contextLoadTimeoutMs=" + contextLoadTimeoutMs +
                '}';
    }

    public static class Builder {
        private int concurrency = DEFAULT_CONCURRENCY;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long backoffBaseMs = DEFAULT_BACKOFF_BASE_MS;
        private long stalledTimeoutMs = DEFAULT_STALLED_TIMEOUT_MS;
        private long stalledCheckIntervalMs = DEFAULT_STALLED_CHECK_INTERVAL_MS;
        private int keepCompleted = DEFAULT_KEEP_COMPLETED;
        private int keepFailed = DEFAULT_KEEP_FAILED;
        private int backlogDegradedThreshold = DEFAULT_BACKLOG_DEGRADED_THRESHOLD;
        private int fetchPageSize = DEFAULT_FETCH_PAGE_SIZE;
        private long slowQueryThresholdMs = DEFAULT_SLOW_QUERY_THRESHOLD_MS;
        private long contextLoadTimeoutMs = DEFAULT_CONTEXT_LOAD_TIMEOUT_MS;
        private long aggregationTtlMinutes = DEFAULT_AGGREGATION_TTL_MINUTES;
        private long lockTimeoutMs = DEFAULT_LOCK_TIMEOUT_MS;

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
            return this;
        }

        public Builder stalledTimeoutMs(long stalledTimeoutMs) {
            this.stalledTimeoutMs = stalledTimeoutMs;
            return this;
        }

        public Builder stalledCheckIntervalMs(long stalledCheckIntervalMs) {
            this.stalledCheckIntervalMs = stalledCheckIntervalMs;
            return this;
        }

        public Builder keepCompleted(int keepCompleted) {
            this.keepCompleted = keepCompleted;
            return this;
        }

        public Builder keepFailed(int keepFailed) {
            this.keepFailed = keepFailed;
            return this;
        }

        public Builder backlogDegradedThreshold(int backlogDegradedThreshold) {
            this.backlogDegradedThreshold = backlogDegradedThreshold;
            return this;
        }

        public Builder fetchPageSize(int fetchPageSize) {
            this.fetchPageSize = fetchPageSize;
            return this;
        }

        public Builder slowQueryThresholdMs(long slowQueryThresholdMs) {
            this.slowQueryThresholdMs = slowQueryThresholdMs;
            return this;
        }

        public Builder contextLoadTimeoutMs(long contextLoadTimeoutMs) {
            this.contextLoadTimeoutMs = contextLoadTimeoutMs;
            return this;
        }

        public Builder aggregationTtlMinutes(long aggregationTtlMinutes) {
            this.aggregationTtlMinutes = aggregationTtlMinutes;
            return this;
        }

        public Builder lockTimeoutMs(long lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
            return this;
        }

        public PipelineOptions build() {
            if (fetchPageSize <= 0) {
                throw new IllegalArgumentException("fetchPageSize must be > 0");
            }
            if (contextLoadTimeoutMs <= 0) {
                throw new IllegalArgumentException("contextLoadTimeoutMs must be > 0");
            }
            if (aggregationTtlMinutes <= 0) {
                throw new IllegalArgumentException("aggregationTtlMinutes must be > 0");
            }
            PipelineOptions options = new PipelineOptions(this);
            // validates queue and lock settings
            options.toQueueConfig();
            options.toLockConfig();
            return options;
        }
    }
}
