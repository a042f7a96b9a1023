package com.sync.pipeline.history;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.queue.JobStatus;
import com.sync.pipeline.store.TenantDocument;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Terminal record of one job, keyed by the job id.
 *
 * @param failedStage stage that failed, null for completed jobs
 * @param durationMs  {@code completedAt - startedAt}, 0 when the job never started
 */
public record JobHistory(String jobId, String tenantId, String integrationType, String dataSourceId,
                         EntityType entityType, String syncId, int batchNumber, JobStatus status,
                         Stage failedStage, String error, Instant startedAt, Instant completedAt,
                         long durationMs, JobMetrics metrics) implements TenantDocument {

    public JobHistory {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(tenantId, "tenantId is required");
        Objects.requireNonNull(status, "status is required");
        if (status != JobStatus.COMPLETED && status != JobStatus.FAILED) {
            throw new IllegalArgumentException("Job history records terminal jobs only, got " + status);
        }
        metrics = metrics != null ? metrics : new JobMetrics();
    }

    /**
     * Builds a record, deriving the duration from the two instants.
     */
    public static JobHistory of(String jobId, String tenantId, String integrationType, String dataSourceId,
                                EntityType entityType, String syncId, int batchNumber, JobStatus status,
                                Stage failedStage, String error, Instant startedAt, Instant completedAt,
                                JobMetrics metrics) {
        long durationMs = startedAt != null && completedAt != null
                ? Math.max(0, Duration.between(startedAt, completedAt).toMillis())
                : 0;
        return new JobHistory(jobId, tenantId, integrationType, dataSourceId, entityType, syncId, batchNumber,
                status, failedStage, error, startedAt, completedAt, durationMs, metrics);
    }

    @Override
    public String getId() {
        return jobId;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }
}
