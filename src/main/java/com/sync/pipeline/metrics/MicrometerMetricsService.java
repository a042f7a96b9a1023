package com.sync.pipeline.metrics;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code pipeline.stage.duration}: Timer (tags: stage, entityType)</li>
 *   <li>{@code pipeline.entities}: Counter (tags: entityType, change)</li>
 *   <li>{@code pipeline.jobs}: Counter (tag: outcome)</li>
 *   <li>{@code pipeline.relationships.changed}: Counter</li>
 *   <li>{@code pipeline.context.load}: Timer</li>
 *   <li>{@code pipeline.context.queries}: DistributionSummary</li>
 *   <li>{@code pipeline.workflow.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter relationshipsChangedCounter;
    private final Timer contextLoadTimer;
    private final DistributionSummary contextQueriesSummary;
    private final DistributionSummary workflowBatchSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.relationshipsChangedCounter = Counter.builder("pipeline.relationships.changed")
                .description("Relationships created, revived or removed by the link stage")
                .register(registry);
        this.contextLoadTimer = Timer.builder("pipeline.context.load")
                .description("Duration of analysis context loads")
                .register(registry);
        this.contextQueriesSummary = DistributionSummary.builder("pipeline.context.queries")
                .description("Bulk reads issued per analysis context load")
                .register(registry);
        this.workflowBatchSummary = DistributionSummary.builder("pipeline.workflow.batch.size")
                .description("Mutations flushed per analysis workflow run")
                .register(registry);
    }

    @Override
    public void recordStageDuration(Stage stage, EntityType entityType, Duration duration) {
        String key = stage.getWireName() + ":" + entityType.getWireName();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("pipeline.stage.duration")
                        .description("Duration of stage handlers")
                        .tag("stage", stage.getWireName())
                        .tag("entityType", entityType.getWireName())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementEntities(EntityType entityType, EntityChange change, long count) {
        if (count <= 0) {
            return;
        }
        String changeTag = change.name().toLowerCase(Locale.ROOT);
        String key = "entities:" + entityType.getWireName() + ":" + changeTag;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("pipeline.entities")
                        .description("Entities by normalization outcome")
                        .tag("entityType", entityType.getWireName())
                        .tag("change", changeTag)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementJobs(JobOutcome outcome) {
        String outcomeTag = outcome.name().toLowerCase(Locale.ROOT);
        Counter counter = counterCache.computeIfAbsent("jobs:" + outcomeTag, k ->
                Counter.builder("pipeline.jobs")
                        .description("Queue job outcomes")
                        .tag("outcome", outcomeTag)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRelationshipsChanged(long count) {
        if (count > 0) {
            relationshipsChangedCounter.increment(count);
        }
    }

    @Override
    public void recordContextLoad(Duration duration, int queryCount) {
        contextLoadTimer.record(duration);
        contextQueriesSummary.record(queryCount);
    }

    @Override
    public void recordWorkflowBatchSize(int size) {
        workflowBatchSummary.record(size);
    }
}
