package com.sync.pipeline.analysis.workflow;

import com.sync.pipeline.analysis.context.AnalysisContext;
import com.sync.pipeline.analysis.context.ContextLoader;
import com.sync.pipeline.logging.LogContext;
import com.sync.pipeline.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs ordered node lists over one {@link AnalysisContext}.
 *
 * <p>A run validates the node order, loads the context once, threads a {@link DeferredBatch}
 * through the nodes and flushes it once at the end. A node failure discards the batch: no
 * derived state of the run is written.</p>
 */
public class WorkflowEngine {
    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final ContextLoader contextLoader;
    private final BatchFlusher flusher;
    private final MetricsService metricsService;

    public WorkflowEngine(ContextLoader contextLoader, BatchFlusher flusher, MetricsService metricsService) {
        this.contextLoader = contextLoader;
        this.flusher = flusher;
        this.metricsService = metricsService;
    }

    /**
     * Checks that every node's requirements are provided by a node running before it.
     *
     * @throws WorkflowDefinitionException on an unsatisfied requirement or a repeated node
     */
    public static void validate(String workflow, List<Node> nodes) {
        Set<String> provided = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (Node node : nodes) {
            if (!names.add(node.name())) {
                throw new WorkflowDefinitionException(workflow + ": node " + node.name() + " appears twice");
            }
            for (String requirement : node.requires()) {
                if (!provided.contains(requirement)) {
                    throw new WorkflowDefinitionException(workflow + ": node " + node.name() + " requires "
                            + requirement + " which no earlier node provides");
                }
            }
            provided.addAll(node.provides());
        }
    }

    /**
     * Runs every applicable worker over a single context load.
     *
     * @return one result per worker that had nodes to run
     */
    public List<WorkflowResult> runAll(AnalysisScope scope, List<AnalysisWorker> workers) {
        Map<String, List<Node>> workflows = new LinkedHashMap<>();
        for (AnalysisWorker worker : workers) {
            List<Node> nodes = worker.nodes(scope);
            if (!nodes.isEmpty()) {
                validate(worker.name(), nodes);
                workflows.put(worker.name(), nodes);
            }
        }
        if (workflows.isEmpty()) {
            return List.of();
        }

        AnalysisContext context = contextLoader.load(scope.tenantId(), scope.dataSourceId());
        List<WorkflowResult> results = new ArrayList<>(workflows.size());
        for (Map.Entry<String, List<Node>> workflow : workflows.entrySet()) {
            results.add(run(workflow.getKey(), context, scope, workflow.getValue()));
        }
        return results;
    }

    /**
     * Runs one node list over an already loaded context.
     *
     * @throws WorkflowDefinitionException if the order is invalid
     * @throws NodeExecutionException      if a node fails; nothing is flushed
     */
    public WorkflowResult run(String workflow, AnalysisContext context, AnalysisScope scope, List<Node> nodes) {
        validate(workflow, nodes);
        try (LogContext ctx = LogContext.forWorkflow(workflow, context.getTenantId(), context.getDataSourceId())) {
            return execute(workflow, context, scope, nodes);
        }
    }

    private WorkflowResult execute(String workflow, AnalysisContext context, AnalysisScope scope, List<Node> nodes) {
        long start = System.nanoTime();

        DeferredBatch batch = DeferredBatch.empty();
        for (Node node : nodes) {
            try {
                batch = node.execute(context, scope, batch);
            } catch (RuntimeException e) {
                log.error("workflow.node.failed workflow={} node={} error={}", workflow, node.name(), e.getMessage(), e);
                throw new NodeExecutionException(node.name(),
                        "Node " + node.name() + " of " + workflow + " failed: " + e.getMessage(), e);
            }
            if (batch == null) {
                throw new NodeExecutionException(node.name(), "Node " + node.name() + " returned no batch");
            }
            log.debug("workflow.node.completed workflow={} node={} queued={}", workflow, node.name(), batch.size());
        }

        metricsService.recordWorkflowBatchSize(batch.size());
        BatchFlusher.FlushResult flushed = flusher.flush(context, batch);
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.info("workflow.completed workflow={} nodes={} entitiesUpdated={} alertsCreated={} alertsResolved={} durationMs={}",
                workflow, nodes.size(), flushed.entitiesUpdated(), flushed.alerts().created(),
                flushed.alerts().resolved(), durationMs);
        return new WorkflowResult(workflow, nodes.size(), flushed.entitiesUpdated(), flushed.alerts().created(),
                flushed.alerts().refreshed(), flushed.alerts().resolved(), durationMs);
    }
}
