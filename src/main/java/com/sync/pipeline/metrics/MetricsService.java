package com.sync.pipeline.metrics;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;

import java.time.Duration;

/**
 * Operational metrics of the pipeline.
 * The default {@link NoOpMetricsService} records nothing.
 */
public interface MetricsService {

    /**
     * Kind of per-record outcome of the Normalize Stage.
     */
    enum EntityChange { CREATED, UPDATED, UNCHANGED, SKIPPED, DELETED }

    /**
     * Terminal or intermediate outcome of a queued job.
     */
    enum JobOutcome { COMPLETED, FAILED, RETRIED }

    void recordStageDuration(Stage stage, EntityType entityType, Duration duration);

    void incrementEntities(EntityType entityType, EntityChange change, long count);

    void incrementJobs(JobOutcome outcome);

    void incrementRelationshipsChanged(long count);

    void recordContextLoad(Duration duration, int queryCount);

    void recordWorkflowBatchSize(int size);
}
