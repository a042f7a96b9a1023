package com.sync.pipeline.cdi;

import com.sync.pipeline.SyncPipeline;
import com.sync.pipeline.alert.AlertService;
import com.sync.pipeline.config.PipelineOptions;
import com.sync.pipeline.connector.Connector;
import com.sync.pipeline.history.JobHistoryService;
import com.sync.pipeline.metrics.MicrometerMetricsService;
import com.sync.pipeline.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the sync pipeline from MicroProfile Config properties.
 *
 * <p>Every {@link Connector} bean in the container gets a fetch stage. All settings are
 * optional:</p>
 * <pre>
 * sync-pipeline:
 *   queue:
 *     concurrency: 5
 *     max-attempts: 3
 *   fetch:
 *     page-size: 500
 * </pre>
 */
@ApplicationScoped
public class SyncPipelineProducer {

    private static final Logger log = LoggerFactory.getLogger(SyncPipelineProducer.class);

    // ── Queue ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sync-pipeline.queue.concurrency", defaultValue = "5")
    int concurrency;

    @Inject
    @ConfigProperty(name = "sync-pipeline.queue.max-attempts", defaultValue = "3")
    int maxAttempts;

    @Inject
    @ConfigProperty(name = "sync-pipeline.queue.backoff-base-ms", defaultValue = "2000")
    long backoffBaseMs;

    @Inject
    @ConfigProperty(name = "sync-pipeline.queue.stalled-timeout-ms", defaultValue = "300000")
    long stalledTimeoutMs;

    @Inject
    @ConfigProperty(name = "sync-pipeline.queue.stalled-check-interval-ms", defaultValue = "30000")
    long stalledCheckIntervalMs;

    @Inject
    @ConfigProperty(name = "sync-pipeline.queue.keep-completed", defaultValue = "100")
    int keepCompleted;

    @Inject
    @ConfigProperty(name = "sync-pipeline.queue.keep-failed", defaultValue = "500")
    int keepFailed;

    @Inject
    @ConfigProperty(name = "sync-pipeline.queue.backlog-degraded-threshold", defaultValue = "1000")
    int backlogDegradedThreshold;

    // ── Stages ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sync-pipeline.fetch.page-size", defaultValue = "500")
    int fetchPageSize;

    @Inject
    @ConfigProperty(name = "sync-pipeline.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    // ── Analysis ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sync-pipeline.analysis.slow-query-threshold-ms", defaultValue = "100")
    long slowQueryThresholdMs;

    @Inject
    @ConfigProperty(name = "sync-pipeline.analysis.context-load-timeout-ms", defaultValue = "30000")
    long contextLoadTimeoutMs;

    @Inject
    @ConfigProperty(name = "sync-pipeline.analysis.aggregation-ttl-minutes", defaultValue = "30")
    long aggregationTtlMinutes;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "sync-pipeline.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "sync-pipeline.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    @Inject
    Instance<Connector> connectors;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public PipelineOptions pipelineOptions() {
        return PipelineOptions.builder()
                .concurrency(concurrency)
                .maxAttempts(maxAttempts)
                .backoffBaseMs(backoffBaseMs)
                .stalledTimeoutMs(stalledTimeoutMs)
                .stalledCheckIntervalMs(stalledCheckIntervalMs)
                .keepCompleted(keepCompleted)
                .keepFailed(keepFailed)
                .backlogDegradedThreshold(backlogDegradedThreshold)
                .fetchPageSize(fetchPageSize)
                .lockTimeoutMs(lockTimeoutMs)
                .slowQueryThresholdMs(slowQueryThresholdMs)
                .contextLoadTimeoutMs(contextLoadTimeoutMs)
                .aggregationTtlMinutes(aggregationTtlMinutes)
                .build();
    }

    @Produces
    @ApplicationScoped
    public SyncPipeline syncPipeline(PipelineOptions options) {
        SyncPipeline.Builder builder = SyncPipeline.builder().options(options);
        connectors.forEach(builder::connector);

        if (metricsEnabled) {
            builder.metricsService(new MicrometerMetricsService(Metrics.globalRegistry));
        }
        if (tracingEnabled) {
            builder.tracingService(new OpenTelemetryTracingService(
                    GlobalOpenTelemetry.getTracer("sync-pipeline")));
        }

        SyncPipeline pipeline = builder.build();
        pipeline.start();
        log.info("Producing SyncPipeline: metrics={} tracing={}", metricsEnabled, tracingEnabled);
        return pipeline;
    }

    public void closePipeline(@Disposes SyncPipeline pipeline) {
        log.info("Closing SyncPipeline");
        pipeline.close();
    }

    @Produces
    @ApplicationScoped
    public AlertService alertService(SyncPipeline pipeline) {
        return pipeline.getAlertService();
    }

    @Produces
    @ApplicationScoped
    public JobHistoryService jobHistoryService(SyncPipeline pipeline) {
        return pipeline.getJobHistoryService();
    }
}
