package com.sync.pipeline.queue;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.FailedPayload;
import com.sync.pipeline.bus.MessageBus;
import com.sync.pipeline.bus.Subscription;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.Topic;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Re-runs a batch whose downstream stage failed with a retryable error.
 *
 * <p>Fetch failures are retried by the queue itself, since the job is still processing
 * at that point. Normalize, link and analysis failures happen after the job completed, so
 * a fresh job for the same sync, batch and cursor is scheduled instead. Re-runs are counted
 * per sync batch and bounded by the queue's attempt limit.</p>
 */
public class PipelineFailureHandler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PipelineFailureHandler.class);

    private final JobQueue queue;
    private final int maxAttempts;
    private final Cache<String, Integer> retriesByBatch = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(Duration.ofDays(1))
            .build();
    private Subscription subscription;

    public PipelineFailureHandler(JobQueue queue, int maxAttempts) {
        this.queue = queue;
        this.maxAttempts = maxAttempts;
    }

    public PipelineFailureHandler subscribe(MessageBus bus) {
        this.subscription = bus.subscribe(Topic.allOf(Stage.FAILED), this::handle);
        return this;
    }

    void handle(EventEnvelope envelope) {
        FailedPayload failed = envelope.payloadAs(FailedPayload.class);
        if (failed.failedStage() == Stage.FETCHED || !failed.error().retryable()) {
            return;
        }
        SyncMetadata sync = failed.syncMetadata();
        if (sync == null) {
            log.warn("pipeline.retry.skipped reason=no-sync-metadata eventId={}", envelope.getEventId());
            return;
        }
        try (LogContext ctx = LogContext.forEvent(envelope)) {
            String batchKey = envelope.getTenantId() + "|" + envelope.getDataSourceId() + "|"
                    + sync.syncId() + "|" + envelope.getEntityType().getWireName() + "|" + sync.batchNumber();
            int priorRetries = retriesByBatch.asMap().getOrDefault(batchKey, 0);
            if (priorRetries + 1 >= maxAttempts) {
                log.error("pipeline.retry.exhausted stage={} syncId={} batch={} retries={}",
                        failed.failedStage().getWireName(), sync.syncId(), sync.batchNumber(), priorRetries);
                return;
            }
            int priority = sync.jobId() == null ? JobRequest.DEFAULT_PRIORITY
                    : queue.getJob(sync.jobId()).map(Job::getPriority).orElse(JobRequest.DEFAULT_PRIORITY);
            JobRequest.Builder retry = JobRequest.builder()
                    .tenantId(envelope.getTenantId())
                    .integrationType(envelope.getIntegrationType())
                    .entityType(envelope.getEntityType())
                    .dataSourceId(envelope.getDataSourceId())
                    .priority(priority)
                    .syncId(sync.syncId())
                    .metadata(JobRequest.META_BATCH_NUMBER, sync.batchNumber())
                    .metadata(JobRequest.META_RETRY_OF, sync.jobId())
                    .metadata(JobRequest.META_PIPELINE_RETRIES, priorRetries + 1);
            if (sync.cursor() != null) {
                retry.metadata(JobRequest.META_CURSOR, sync.cursor());
            }
            retriesByBatch.put(batchKey, priorRetries + 1);
            String jobId = queue.schedule(retry.build());
            log.warn("pipeline.retry.scheduled stage={} syncId={} batch={} retry={} jobId={} error={}",
                    failed.failedStage().getWireName(), sync.syncId(), sync.batchNumber(),
                    priorRetries + 1, jobId, failed.error().message());
        }
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.close();
        }
    }
}
