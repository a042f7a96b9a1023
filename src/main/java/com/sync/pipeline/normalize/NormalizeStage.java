package com.sync.pipeline.normalize;

import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.FailedPayload;
import com.sync.pipeline.bus.FetchedPayload;
import com.sync.pipeline.bus.MessageBus;
import com.sync.pipeline.bus.ProcessedPayload;
import com.sync.pipeline.bus.Subscription;
import com.sync.pipeline.bus.Topic;
import com.sync.pipeline.core.UnsupportedEntityTypeException;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.fetch.DataFetchRecord;
import com.sync.pipeline.history.JobMetrics;
import com.sync.pipeline.lock.DistributedLock;
import com.sync.pipeline.lock.LockAcquisitionException;
import com.sync.pipeline.logging.LogContext;
import com.sync.pipeline.metrics.MetricsService;
import com.sync.pipeline.store.EntityRepository;
import com.sync.pipeline.store.StorageException;
import com.sync.pipeline.tenant.TenantContext;
import com.sync.pipeline.tracing.Span;
import com.sync.pipeline.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalize stage of one entity type.
 *
 * <p>For each {@code fetched.{entityType}} batch the stored entities of the same source are
 * loaded in one read and diffed by content hash. Records with an unchanged hash are counted
 * as unchanged and only re-stamped with the sync id when it differs; new and changed records
 * are normalized and upserted. The {@code processed} event lists only created and updated
 * entity ids, which makes replaying a batch a no-op.</p>
 *
 * <p>The load-diff-write cycle runs under a lock on
 * {@code tenant:integration:dataSource:entityType} so concurrent replays cannot insert
 * duplicates.</p>
 */
public class NormalizeStage implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NormalizeStage.class);

    private final EntityType entityType;
    private final NormalizerRegistry normalizers;
    private final EntityRepository entities;
    private final DistributedLock lock;
    private final MessageBus bus;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;
    private Subscription subscription;

    public NormalizeStage(EntityType entityType, NormalizerRegistry normalizers, EntityRepository entities,
                          DistributedLock lock, MessageBus bus, MetricsService metricsService,
                          TracingService tracingService, Clock clock) {
        this.entityType = entityType;
        this.normalizers = normalizers;
        this.entities = entities;
        this.lock = lock;
        this.bus = bus;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.clock = clock;
    }

    public NormalizeStage subscribe() {
        this.subscription = bus.subscribe(Topic.of(Stage.FETCHED, entityType), this::handle);
        log.info("stage.subscribed stage=normalize entityType={}", entityType.getWireName());
        return this;
    }

    void handle(EventEnvelope envelope) {
        FetchedPayload fetched = envelope.payloadAs(FetchedPayload.class);
        try (TenantContext.TenantScope tenant = TenantContext.scoped(envelope.getTenantId());
             LogContext ctx = LogContext.forEvent(envelope);
             Span span = tracingService.startSpan("pipeline.normalize", envelope)) {

            long startNanos = System.nanoTime();
            JobMetrics metrics = fetched.metrics().copy();
            BatchResult result;
            try {
                Normalizer normalizer = normalizers.find(envelope.getIntegrationType(), envelope.getEntityType())
                        .orElseThrow(() -> new UnsupportedEntityTypeException("No normalizer for "
                                + envelope.getIntegrationType() + "/" + envelope.getEntityType().getWireName()));
                if (envelope.getDataSourceId() == null) {
                    throw new UnsupportedEntityTypeException("Entities require a data source");
                }
                String lockKey = lockKey(envelope.getTenantId(), envelope.getIntegrationType(),
                        envelope.getDataSourceId(), envelope.getEntityType());
                result = lock.withLock(lockKey, () -> process(envelope, fetched, normalizer, metrics));
            } catch (UnsupportedEntityTypeException e) {
                publishFailure(envelope, fetched, metrics, span, e, false);
                return;
            } catch (StorageException | LockAcquisitionException e) {
                publishFailure(envelope, fetched, metrics, span, e, true);
                return;
            } catch (RuntimeException e) {
                publishFailure(envelope, fetched, metrics, span, e, true);
                return;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordStageTime(JobMetrics.Phase.NORMALIZE, elapsed.toMillis());
            metricsService.recordStageDuration(Stage.PROCESSED, entityType, elapsed);
            metricsService.incrementEntities(entityType, MetricsService.EntityChange.CREATED, result.created);
            metricsService.incrementEntities(entityType, MetricsService.EntityChange.UPDATED, result.updated);
            metricsService.incrementEntities(entityType, MetricsService.EntityChange.UNCHANGED, result.unchanged);
            metricsService.incrementEntities(entityType, MetricsService.EntityChange.SKIPPED, result.skipped);

            bus.publish(envelope.next(Stage.PROCESSED, new ProcessedPayload(result.created, result.updated,
                    result.unchanged, result.skipped, result.changedIds, fetched.syncMetadata(), metrics)));
            span.setAttribute("changed", result.changedIds.size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("normalize.completed created={} updated={} unchanged={} skipped={} durationMs={}",
                    result.created, result.updated, result.unchanged, result.skipped, elapsed.toMillis());
        }
    }

    private BatchResult process(EventEnvelope envelope, FetchedPayload fetched, Normalizer normalizer,
                                JobMetrics metrics) {
        String syncId = fetched.syncMetadata() != null ? fetched.syncMetadata().syncId() : null;
        Instant now = clock.instant();

        Map<String, Entity> existing = new HashMap<>();
        for (Entity entity : entities.findBySource(envelope.getTenantId(), envelope.getIntegrationType(),
                envelope.getDataSourceId(), envelope.getEntityType())) {
            existing.put(entity.getExternalId(), entity);
        }
        metrics.addQueries(1);

        // a page may repeat a record; the last occurrence wins
        Map<String, DataFetchRecord> incoming = new LinkedHashMap<>();
        for (DataFetchRecord record : fetched.data()) {
            incoming.put(record.externalId(), record);
        }

        BatchResult result = new BatchResult();
        List<Entity> toCreate = new ArrayList<>();
        List<Entity> toUpdate = new ArrayList<>();
        List<Entity> toTouch = new ArrayList<>();

        for (DataFetchRecord record : incoming.values()) {
            Entity stored = existing.get(record.externalId());
            if (stored != null && !stored.isDeleted() && record.dataHash().equals(stored.getDataHash())) {
                result.unchanged++;
                if (syncId != null && !syncId.equals(stored.getSyncId())) {
                    toTouch.add(stored.toBuilder().syncId(syncId).build());
                }
                continue;
            }

            NormalizedRecord normalized;
            try {
                normalized = normalizer.normalize(record);
            } catch (NormalizationException e) {
                result.skipped++;
                log.warn("normalize.record.skipped externalId={} reason={}", record.externalId(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                // a malformed raw record must not sink the rest of the page
                result.skipped++;
                log.warn("normalize.record.failed externalId={} error={}", record.externalId(), e.toString());
                continue;
            }

            if (stored == null) {
                toCreate.add(Entity.builder()
                        .tenantId(envelope.getTenantId())
                        .integrationType(envelope.getIntegrationType())
                        .dataSourceId(envelope.getDataSourceId())
                        .entityType(envelope.getEntityType())
                        .externalId(record.externalId())
                        .dataHash(record.dataHash())
                        .siteId(record.siteId())
                        .normalizedData(normalized.normalizedData())
                        .rawData(record.rawData())
                        .tags(normalized.tags())
                        .syncId(syncId)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                result.created++;
            } else {
                toUpdate.add(stored.toBuilder()
                        .dataHash(record.dataHash())
                        .siteId(record.siteId())
                        .normalizedData(normalized.normalizedData())
                        .rawData(record.rawData())
                        .tags(mergeTags(stored.getTags(), normalized.tags(), normalizer.managedTags()))
                        .syncId(syncId)
                        .updatedAt(now)
                        .deletedAt(null)
                        .build());
                result.updated++;
            }
        }

        if (!toCreate.isEmpty()) {
            entities.insert(toCreate);
            metrics.addMutations(1);
        }
        List<Entity> updates = new ArrayList<>(toUpdate);
        updates.addAll(toTouch);
        if (!updates.isEmpty()) {
            entities.update(updates);
            metrics.addMutations(1);
        }

        toCreate.forEach(e -> result.changedIds.add(e.getId()));
        toUpdate.forEach(e -> result.changedIds.add(e.getId()));
        metrics.addEntitiesCreated(result.created)
                .addEntitiesUpdated(result.updated)
                .addEntitiesUnchanged(result.unchanged)
                .addEntitiesSkipped(result.skipped);
        if (!toTouch.isEmpty()) {
            log.debug("normalize.touched count={} syncId={}", toTouch.size(), syncId);
        }
        return result;
    }

    /**
     * Key of the lock that serializes writes to the entities of one source and type.
     */
    public static String lockKey(String tenantId, String integrationType, String dataSourceId,
                                 EntityType entityType) {
        return DistributedLock.key(tenantId, integrationType, dataSourceId, entityType.getWireName());
    }

    static Set<String> mergeTags(Set<String> stored, Set<String> fromNormalizer, Set<String> managed) {
        Set<String> merged = new TreeSet<>(stored);
        merged.removeAll(managed);
        merged.addAll(fromNormalizer);
        return merged;
    }

    private void publishFailure(EventEnvelope envelope, FetchedPayload fetched, JobMetrics metrics, Span span,
                                RuntimeException e, boolean retryable) {
        span.fail(e);
        metrics.recordError(e.getMessage(), e);
        log.error("normalize.failed retryable={} error={}", retryable, e.getMessage(), e);
        bus.publish(envelope.next(Stage.FAILED, new FailedPayload(
                new FailedPayload.ErrorInfo(e.getMessage(), retryable), Stage.PROCESSED, clock.instant(),
                fetched.syncMetadata(), metrics)));
    }

    public EntityType getEntityType() {
        return entityType;
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.close();
        }
    }

    private static final class BatchResult {
        private int created;
        private int updated;
        private int unchanged;
        private int skipped;
        private final List<String> changedIds = new ArrayList<>();
    }
}
