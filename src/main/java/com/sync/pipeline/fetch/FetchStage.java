package com.sync.pipeline.fetch;

import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.FetchedPayload;
import com.sync.pipeline.bus.MessageBus;
import com.sync.pipeline.bus.Subscription;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.SyncPayload;
import com.sync.pipeline.bus.Topic;
import com.sync.pipeline.connector.Connector;
import com.sync.pipeline.connector.ConnectorException;
import com.sync.pipeline.connector.ConnectorHealth;
import com.sync.pipeline.connector.ConnectorRegistry;
import com.sync.pipeline.connector.FetchPage;
import com.sync.pipeline.connector.FetchRequest;
import com.sync.pipeline.connector.VendorRecord;
import com.sync.pipeline.core.UnsupportedEntityTypeException;
import com.sync.pipeline.core.model.DataSource;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.hash.DataHasher;
import com.sync.pipeline.history.JobMetrics;
import com.sync.pipeline.logging.LogContext;
import com.sync.pipeline.metrics.MetricsService;
import com.sync.pipeline.queue.JobQueue;
import com.sync.pipeline.queue.JobRequest;
import com.sync.pipeline.store.DocumentStore;
import com.sync.pipeline.store.StorageException;
import com.sync.pipeline.tenant.TenantContext;
import com.sync.pipeline.tracing.Span;
import com.sync.pipeline.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetch stage of one integration type.
 *
 * <p>Consumes sync events from {@code {integrationType}.sync.*}, fetches one page through the
 * integration's {@link Connector}, hashes each record and resolves its site, closes the
 * originating job and publishes {@code fetched.{entityType}}. When the page is not the last,
 * the job for the next page is enqueued with the same sync id.</p>
 *
 * <p>Failures close the job as failed and publish nothing: connector configuration and
 * authentication failures and unsupported entity types are not retryable, transient
 * connector and storage failures are.</p>
 */
public class FetchStage implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetchStage.class);

    private final String integrationType;
    private final ConnectorRegistry connectors;
    private final DocumentStore<DataSource> dataSources;
    private final JobQueue queue;
    private final MessageBus bus;
    private final DataHasher hasher;
    private final SiteResolver siteResolver;
    private final int pageSize;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private Subscription subscription;

    public FetchStage(String integrationType, ConnectorRegistry connectors, DocumentStore<DataSource> dataSources,
                      JobQueue queue, MessageBus bus, DataHasher hasher, SiteResolver siteResolver,
                      int pageSize, MetricsService metricsService, TracingService tracingService) {
        this.integrationType = integrationType;
        this.connectors = connectors;
        this.dataSources = dataSources;
        this.queue = queue;
        this.bus = bus;
        this.hasher = hasher;
        this.siteResolver = siteResolver;
        this.pageSize = pageSize;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public FetchStage subscribe() {
        this.subscription = bus.subscribe(Topic.allSyncsOf(integrationType), this::handle);
        log.info("stage.subscribed stage=fetch integrationType={}", integrationType);
        return this;
    }

    void handle(EventEnvelope envelope) {
        SyncPayload sync = envelope.payloadAs(SyncPayload.class);
        try (TenantContext.TenantScope tenant = TenantContext.scoped(envelope.getTenantId());
             LogContext ctx = LogContext.forEvent(envelope).with("jobId", sync.jobId());
             Span span = tracingService.startSpan("pipeline.fetch", envelope)) {

            long startNanos = System.nanoTime();
            JobMetrics metrics = new JobMetrics();
            FetchPage page;
            List<DataFetchRecord> records;
            try {
                DataSource dataSource = resolveDataSource(envelope, metrics);
                page = fetchPage(envelope, sync.syncMetadata(), dataSource, metrics);
                records = toFetchRecords(envelope.getEntityType(), dataSource, page.records());
            } catch (ConnectorException e) {
                fail(span, sync, e, e.isRetryable());
                return;
            } catch (UnsupportedEntityTypeException e) {
                fail(span, sync, e, false);
                return;
            } catch (StorageException e) {
                fail(span, sync, e, true);
                return;
            } catch (RuntimeException e) {
                log.error("fetch.unexpected error={}", e.getMessage(), e);
                fail(span, sync, e, true);
                return;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordStageTime(JobMetrics.Phase.FETCH, elapsed.toMillis());
            metricsService.recordStageDuration(Stage.FETCHED, envelope.getEntityType(), elapsed);

            try {
                queue.completeJob(sync.jobId());
            } catch (IllegalStateException e) {
                log.warn("fetch.job.superseded reason={}", e.getMessage());
                span.setStatus(Span.SpanStatus.ERROR);
                return;
            }

            SyncMetadata syncMetadata = sync.syncMetadata().withFinalBatch(!page.hasMore());
            // a pipeline retry re-reads a page whose first fetch already enqueued the following one
            boolean retry = sync.metadata().containsKey(JobRequest.META_RETRY_OF);
            if (page.hasMore() && !retry) {
                scheduleNextPage(envelope, sync, page.nextCursor());
            } else if (page.hasMore()) {
                log.debug("fetch.next-page.skipped retryOf={}", sync.metadata().get(JobRequest.META_RETRY_OF));
            }

            bus.publish(envelope.next(Stage.FETCHED, new FetchedPayload(records, records.size(),
                    page.hasMore(), page.nextCursor(), syncMetadata, metrics)));
            span.setAttribute("records", records.size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("fetch.completed records={} hasMore={} batch={} durationMs={}",
                    records.size(), page.hasMore(), syncMetadata.batchNumber(), elapsed.toMillis());
        }
    }

    private DataSource resolveDataSource(EventEnvelope envelope, JobMetrics metrics) {
        if (envelope.getDataSourceId() == null) {
            return null;
        }
        metrics.addQueries(1);
        return dataSources.get(envelope.getTenantId(), envelope.getDataSourceId())
                .orElseThrow(() -> ConnectorException.configuration(
                        "Data source not found: " + envelope.getDataSourceId()));
    }

    private FetchPage fetchPage(EventEnvelope envelope, SyncMetadata syncMetadata, DataSource dataSource,
                                JobMetrics metrics) {
        EntityType entityType = envelope.getEntityType();
        Connector connector = connectors.require(integrationType);
        if (!connector.supports(entityType)) {
            throw new UnsupportedEntityTypeException(
                    "Integration " + integrationType + " does not support " + entityType.getWireName());
        }

        metrics.addExternalCalls(1);
        ConnectorHealth health = connector.checkHealth(dataSource);
        if (!health.ok()) {
            ConnectorException.Kind kind = health.retryable()
                    ? ConnectorException.Kind.TRANSIENT
                    : ConnectorException.Kind.CONFIGURATION;
            throw new ConnectorException(kind, "Connector health check failed: " + health.message(), null);
        }

        metrics.addExternalCalls(1);
        return connector.fetch(entityType,
                new FetchRequest(envelope.getTenantId(), dataSource, syncMetadata.cursor(), pageSize));
    }

    private List<DataFetchRecord> toFetchRecords(EntityType entityType, DataSource dataSource,
                                                 List<VendorRecord> vendorRecords) {
        List<DataFetchRecord> records = new ArrayList<>(vendorRecords.size());
        for (VendorRecord record : vendorRecords) {
            String hash = hasher.hash(entityType, record.data());
            String siteId = siteResolver.resolve(dataSource, entityType, record);
            records.add(new DataFetchRecord(record.externalId(), siteId, hash, record.data()));
        }
        return records;
    }

    private void scheduleNextPage(EventEnvelope envelope, SyncPayload sync, String cursor) {
        SyncMetadata current = sync.syncMetadata();
        int priority = queue.getJob(sync.jobId())
                .map(job -> job.getRequest().priority())
                .orElse(JobRequest.DEFAULT_PRIORITY);
        JobRequest next = JobRequest.builder()
                .action(sync.action())
                .tenantId(envelope.getTenantId())
                .integrationType(envelope.getIntegrationType())
                .entityType(envelope.getEntityType())
                .dataSourceId(envelope.getDataSourceId())
                .priority(priority)
                .syncId(current.syncId())
                .metadata(JobRequest.META_CURSOR, cursor)
                .metadata(JobRequest.META_BATCH_NUMBER, current.batchNumber() + 1)
                .build();
        String jobId = queue.schedule(next);
        log.debug("fetch.next-page.scheduled jobId={} batch={} cursor={}", jobId, current.batchNumber() + 1, cursor);
    }

    private void fail(Span span, SyncPayload sync, RuntimeException e, boolean retryable) {
        span.fail(e);
        log.warn("fetch.failed retryable={} error={}", retryable, e.getMessage());
        try {
            queue.failJob(sync.jobId(), e.getMessage(), retryable);
        } catch (IllegalStateException stateError) {
            log.warn("fetch.job.superseded reason={}", stateError.getMessage());
        }
    }

    public String getIntegrationType() {
        return integrationType;
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.close();
        }
    }
}
