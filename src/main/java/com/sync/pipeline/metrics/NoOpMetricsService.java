package com.sync.pipeline.metrics;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(Stage stage, EntityType entityType, Duration duration) {
    }

    @Override
    public void incrementEntities(EntityType entityType, EntityChange change, long count) {
    }

    @Override
    public void incrementJobs(JobOutcome outcome) {
    }

    @Override
    public void incrementRelationshipsChanged(long count) {
    }

    @Override
    public void recordContextLoad(Duration duration, int queryCount) {
    }

    @Override
    public void recordWorkflowBatchSize(int size) {
    }
}
