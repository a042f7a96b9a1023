package com.sync.pipeline.analysis.workflow;

import com.sync.pipeline.analysis.context.AnalysisContext;

import java.util.Set;

/**
 * One unit of analysis logic.
 *
 * <p>A node reads the shared {@link AnalysisContext} and the batch accumulated by the nodes
 * before it, and returns the batch with its own mutations queued. It never writes to a store.
 * Nodes declare the capabilities they consume and produce, e.g. {@code tag:Admin}; the
 * {@link WorkflowEngine} rejects an order in which a node runs before its requirements are
 * provided.</p>
 */
public interface Node {

    String name();

    default Set<String> requires() {
        return Set.of();
    }

    default Set<String> provides() {
        return Set.of();
    }

    DeferredBatch execute(AnalysisContext context, AnalysisScope scope, DeferredBatch batch);
}
