package com.sync.pipeline.history;

import com.sync.pipeline.bus.CompletedPayload;
import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.FailedPayload;
import com.sync.pipeline.bus.MessageBus;
import com.sync.pipeline.bus.Subscription;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.Topic;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.queue.BusJobDispatcher;
import com.sync.pipeline.queue.Job;
import com.sync.pipeline.queue.JobListener;
import com.sync.pipeline.queue.JobRequest;
import com.sync.pipeline.queue.JobStatus;
import com.sync.pipeline.tenant.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Persists one {@link JobHistory} per job from the terminal signal of its batch:
 * {@code completed.*}, {@code failed.*}, or the queue's terminal failure of a fetch job.
 */
public class JobHistoryRecorder implements JobListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobHistoryRecorder.class);

    private final JobHistoryService historyService;
    private final Clock clock;
    private Subscription completedSubscription;
    private Subscription failedSubscription;

    public JobHistoryRecorder(JobHistoryService historyService, Clock clock) {
        this.historyService = historyService;
        this.clock = clock;
    }

    public JobHistoryRecorder subscribe(MessageBus bus) {
        this.completedSubscription = bus.subscribe(Topic.allOf(Stage.COMPLETED), this::onCompletedEvent);
        this.failedSubscription = bus.subscribe(Topic.allOf(Stage.FAILED), this::onFailedEvent);
        return this;
    }

    void onCompletedEvent(EventEnvelope envelope) {
        CompletedPayload completed = envelope.payloadAs(CompletedPayload.class);
        record(envelope, completed.syncMetadata(), JobStatus.COMPLETED, null, null, completed.metrics());
    }

    void onFailedEvent(EventEnvelope envelope) {
        FailedPayload failed = envelope.payloadAs(FailedPayload.class);
        record(envelope, failed.syncMetadata(), JobStatus.FAILED, failed.failedStage(),
                failed.error().message(), failed.metrics());
    }

    private void record(EventEnvelope envelope, SyncMetadata sync, JobStatus status, Stage failedStage,
                        String error, JobMetrics metrics) {
        if (sync == null || sync.jobId() == null) {
            log.warn("history.skipped reason=no-job eventId={}", envelope.getEventId());
            return;
        }
        try (TenantContext.TenantScope tenant = TenantContext.scoped(envelope.getTenantId())) {
            historyService.record(JobHistory.of(sync.jobId(), envelope.getTenantId(), envelope.getIntegrationType(),
                    envelope.getDataSourceId(), envelope.getEntityType(), sync.syncId(), sync.batchNumber(),
                    status, failedStage, error, sync.startedAt(), clock.instant(), metrics));
        }
    }

    /**
     * Terminal failure of a job inside the queue, after its attempts are exhausted.
     */
    @Override
    public void onFailed(Job job) {
        JobRequest request = job.getRequest();
        JobMetrics metrics = new JobMetrics()
                .recordError(job.getError(), null)
                .setRetryCount(Math.max(0, job.getAttempt() - 1));
        Instant completedAt = job.getCompletedAt() != null ? job.getCompletedAt() : clock.instant();
        try (TenantContext.TenantScope tenant = TenantContext.scoped(request.tenantId())) {
            historyService.record(JobHistory.of(job.getId(), request.tenantId(), request.integrationType(),
                    request.dataSourceId(), request.entityType(), request.syncId(),
                    BusJobDispatcher.batchNumber(request), JobStatus.FAILED, Stage.FETCHED, job.getError(),
                    job.getStartedAt(), completedAt, metrics));
        }
    }

    @Override
    public void close() {
        if (completedSubscription != null) {
            completedSubscription.close();
        }
        if (failedSubscription != null) {
            failedSubscription.close();
        }
    }
}
