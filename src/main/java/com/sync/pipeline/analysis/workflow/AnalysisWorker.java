package com.sync.pipeline.analysis.workflow;

import java.util.List;

/**
 * Assembles the ordered node list of one workflow for a run.
 */
public interface AnalysisWorker {

    String name();

    /**
     * @return the nodes to run, or an empty list when the worker does not apply to the scope
     */
    List<Node> nodes(AnalysisScope scope);

    /**
     * Workers that evaluate the data source as a whole run once per sync, after its final batch.
     */
    default boolean requiresFullContext() {
        return false;
    }
}
