package com.sync.pipeline.analysis.workflow;

/**
 * Outcome of one workflow run.
 */
public record WorkflowResult(String workflow, int nodesRun, int entitiesUpdated, int alertsCreated,
                             int alertsRefreshed, int alertsResolved, long durationMs) {

    public static WorkflowResult skipped(String workflow) {
        return new WorkflowResult(workflow, 0, 0, 0, 0, 0, 0);
    }
}
