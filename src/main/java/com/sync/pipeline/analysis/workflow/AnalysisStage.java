package com.sync.pipeline.analysis.workflow;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sync.pipeline.bus.CompletedPayload;
import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.FailedPayload;
import com.sync.pipeline.bus.LinkedPayload;
import com.sync.pipeline.bus.MessageBus;
import com.sync.pipeline.bus.Subscription;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.Topic;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.history.JobMetrics;
import com.sync.pipeline.lock.LockAcquisitionException;
import com.sync.pipeline.logging.LogContext;
import com.sync.pipeline.metrics.MetricsService;
import com.sync.pipeline.store.StorageException;
import com.sync.pipeline.tenant.TenantContext;
import com.sync.pipeline.tracing.Span;
import com.sync.pipeline.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Analysis stage: runs the registered {@link AnalysisWorker}s for every {@code linked.*} batch
 * and publishes {@code completed.{entityType}}.
 *
 * <p>Workers that need the whole data source are deferred until the final batch of a sync.
 * Until then the changed entity ids are accumulated per {@code (tenant, dataSource, syncId)}
 * in a cache whose entries expire after the aggregation TTL, so a sync whose final batch never
 * arrives does not hold memory.</p>
 */
public class AnalysisStage implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AnalysisStage.class);

    private final List<AnalysisWorker> workers;
    private final WorkflowEngine engine;
    private final MessageBus bus;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;
    private final Cache<String, Aggregate> aggregates;
    private Subscription subscription;

    public AnalysisStage(List<AnalysisWorker> workers, WorkflowEngine engine, MessageBus bus,
                         Duration aggregationTtl, MetricsService metricsService, TracingService tracingService,
                         Clock clock) {
        this.workers = List.copyOf(workers);
        this.engine = engine;
        this.bus = bus;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.clock = clock;
        this.aggregates = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(aggregationTtl)
                .build();
    }

    public AnalysisStage subscribe() {
        this.subscription = bus.subscribe(Topic.allOf(Stage.LINKED), this::handle);
        log.info("stage.subscribed stage=analyze workers={}", workers.size());
        return this;
    }

    void handle(EventEnvelope envelope) {
        LinkedPayload linked = envelope.payloadAs(LinkedPayload.class);
        try (TenantContext.TenantScope tenant = TenantContext.scoped(envelope.getTenantId());
             LogContext ctx = LogContext.forEvent(envelope);
             Span span = tracingService.startSpan("pipeline.analyze", envelope)) {

            long startNanos = System.nanoTime();
            JobMetrics metrics = linked.metrics().copy();
            List<WorkflowResult> results;
            try {
                results = analyze(envelope, linked);
            } catch (WorkflowDefinitionException | NodeExecutionException e) {
                publishFailure(envelope, linked, metrics, span, e, false);
                return;
            } catch (StorageException | LockAcquisitionException e) {
                publishFailure(envelope, linked, metrics, span, e, true);
                return;
            } catch (RuntimeException e) {
                publishFailure(envelope, linked, metrics, span, e, true);
                return;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordStageTime(JobMetrics.Phase.ANALYZE, elapsed.toMillis());
            metricsService.recordStageDuration(Stage.COMPLETED, envelope.getEntityType(), elapsed);

            int raised = results.stream().mapToInt(WorkflowResult::alertsCreated).sum();
            int resolved = results.stream().mapToInt(WorkflowResult::alertsResolved).sum();
            bus.publish(envelope.next(Stage.COMPLETED,
                    new CompletedPayload(results.size(), raised, resolved, linked.syncMetadata(), metrics)));
            span.setAttribute("workflows", results.size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("analyze.completed workflows={} alertsRaised={} alertsResolved={} durationMs={}",
                    results.size(), raised, resolved, elapsed.toMillis());
        }
    }

    private List<WorkflowResult> analyze(EventEnvelope envelope, LinkedPayload linked) {
        if (envelope.getDataSourceId() == null || workers.isEmpty()) {
            return List.of();
        }
        SyncMetadata sync = linked.syncMetadata();
        boolean finalBatch = sync == null || sync.finalBatch();
        String syncId = sync != null ? sync.syncId() : envelope.getTraceId();
        Set<String> batchIds = new LinkedHashSet<>(linked.changedEntityIds());

        List<AnalysisWorker> perBatch = new ArrayList<>();
        List<AnalysisWorker> fullContext = new ArrayList<>();
        for (AnalysisWorker worker : workers) {
            (worker.requiresFullContext() ? fullContext : perBatch).add(worker);
        }

        List<WorkflowResult> results = new ArrayList<>();
        if (!perBatch.isEmpty() && !batchIds.isEmpty()) {
            AnalysisScope scope = new AnalysisScope(envelope.getTenantId(), envelope.getIntegrationType(),
                    envelope.getDataSourceId(), syncId, EnumSet.of(envelope.getEntityType()), batchIds, finalBatch);
            results.addAll(engine.runAll(scope, perBatch));
        }
        if (fullContext.isEmpty()) {
            return results;
        }

        String key = envelope.getTenantId() + "|" + envelope.getDataSourceId() + "|" + syncId;
        if (!finalBatch) {
            if (!batchIds.isEmpty()) {
                aggregates.get(key, k -> new Aggregate()).add(envelope.getEntityType(), batchIds);
            }
            return results;
        }

        Aggregate aggregate = aggregates.asMap().remove(key);
        if (aggregate == null) {
            aggregate = new Aggregate();
        }
        if (!batchIds.isEmpty()) {
            aggregate.add(envelope.getEntityType(), batchIds);
        }
        if (aggregate.entityIds.isEmpty()) {
            log.debug("analyze.skipped reason=no-changes syncId={}", syncId);
            return results;
        }
        AnalysisScope scope = new AnalysisScope(envelope.getTenantId(), envelope.getIntegrationType(),
                envelope.getDataSourceId(), syncId, aggregate.types, aggregate.entityIds, true);
        results.addAll(engine.runAll(scope, fullContext));
        return results;
    }

    private void publishFailure(EventEnvelope envelope, LinkedPayload linked, JobMetrics metrics, Span span,
                                RuntimeException e, boolean retryable) {
        span.fail(e);
        metrics.recordError(e.getMessage(), e);
        log.error("analyze.failed retryable={} error={}", retryable, e.getMessage(), e);
        bus.publish(envelope.next(Stage.FAILED, new FailedPayload(
                new FailedPayload.ErrorInfo(e.getMessage(), retryable), Stage.COMPLETED, clock.instant(),
                linked.syncMetadata(), metrics)));
    }

    /**
     * Number of syncs with deferred changes awaiting their final batch.
     */
    public long getPendingAggregations() {
        aggregates.cleanUp();
        return aggregates.estimatedSize();
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.close();
        }
        aggregates.invalidateAll();
    }

    private static final class Aggregate {
        private final Set<EntityType> types = EnumSet.noneOf(EntityType.class);
        private final Set<String> entityIds = new LinkedHashSet<>();

        synchronized void add(EntityType type, Set<String> ids) {
            types.add(type);
            entityIds.addAll(ids);
        }
    }
}
