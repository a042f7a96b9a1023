package com.sync.pipeline.bus;

import com.sync.pipeline.history.JobMetrics;

/**
 * Terminal success of one batch after analysis.
 */
public record CompletedPayload(int workflowsRun, int alertsRaised, int alertsResolved,
                               SyncMetadata syncMetadata, JobMetrics metrics) implements EventPayload {

    public CompletedPayload {
        metrics = metrics != null ? metrics : new JobMetrics();
    }
}
