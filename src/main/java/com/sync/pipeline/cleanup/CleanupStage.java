package com.sync.pipeline.cleanup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.LinkedPayload;
import com.sync.pipeline.bus.MessageBus;
import com.sync.pipeline.bus.Subscription;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.Topic;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.Relationship;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.lock.DistributedLock;
import com.sync.pipeline.lock.LockAcquisitionException;
import com.sync.pipeline.logging.LogContext;
import com.sync.pipeline.metrics.MetricsService;
import com.sync.pipeline.normalize.NormalizeStage;
import com.sync.pipeline.store.EntityRepository;
import com.sync.pipeline.store.RelationshipRepository;
import com.sync.pipeline.store.StorageException;
import com.sync.pipeline.tenant.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Mark-and-sweep removal of entities that disappeared from the vendor.
 *
 * <p>The Normalize Stage stamps every entity it sees with the sync id. Once every batch of
 * a sync, from the first to the final one, has been linked, the live entities of that source
 * and type carrying another sync id were not returned by the vendor and are soft-deleted
 * together with their relationships.</p>
 *
 * <p>Pages are handled concurrently, so the final page may be linked before an earlier one.
 * Linked batch numbers are tracked per sync until the set is complete; a sync whose pages
 * never all arrive is not swept and its tracking entry expires.</p>
 */
public class CleanupStage implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CleanupStage.class);

    private final EntityRepository entities;
    private final RelationshipRepository relationships;
    private final DistributedLock lock;
    private final MessageBus bus;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Cache<String, SyncProgress> progress;
    private Subscription subscription;

    /**
     * @param trackingTtl how long the linked batches of an unfinished sync are remembered
     */
    public CleanupStage(EntityRepository entities, RelationshipRepository relationships, DistributedLock lock,
                        MessageBus bus, MetricsService metricsService, Duration trackingTtl, Clock clock) {
        this.entities = entities;
        this.relationships = relationships;
        this.lock = lock;
        this.bus = bus;
        this.metricsService = metricsService;
        this.clock = clock;
        this.progress = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterAccess(trackingTtl)
                .build();
    }

    public CleanupStage subscribe() {
        this.subscription = bus.subscribe(Topic.allOf(Stage.LINKED), this::handle);
        log.info("stage.subscribed stage=cleanup");
        return this;
    }

    void handle(EventEnvelope envelope) {
        SyncMetadata sync = envelope.payloadAs(LinkedPayload.class).syncMetadata();
        if (sync == null || envelope.getDataSourceId() == null) {
            return;
        }
        try (TenantContext.TenantScope tenant = TenantContext.scoped(envelope.getTenantId());
             LogContext ctx = LogContext.forEvent(envelope)) {
            if (!recordLinked(envelope, sync)) {
                return;
            }
            String lockKey = NormalizeStage.lockKey(envelope.getTenantId(), envelope.getIntegrationType(),
                    envelope.getDataSourceId(), envelope.getEntityType());
            int deleted = lock.withLock(lockKey, () -> sweep(envelope, sync.syncId()));
            if (deleted > 0) {
                metricsService.incrementEntities(envelope.getEntityType(), MetricsService.EntityChange.DELETED, deleted);
            }
        } catch (StorageException | LockAcquisitionException e) {
            // the next sync of the same scope sweeps again
            log.error("cleanup.failed syncId={} error={}", sync.syncId(), e.getMessage(), e);
        }
    }

    /**
     * Records a linked batch and tells whether it completed its sync. Returns true at most
     * once per sync.
     */
    private boolean recordLinked(EventEnvelope envelope, SyncMetadata sync) {
        String key = progressKey(envelope, sync.syncId());
        SyncProgress syncProgress = progress.get(key, k -> new SyncProgress());
        boolean complete;
        int missing;
        synchronized (syncProgress) {
            complete = syncProgress.record(sync.batchNumber(), sync.finalBatch());
            missing = syncProgress.missing();
        }
        if (!complete) {
            log.debug("cleanup.waiting syncId={} batch={} missingBatches={}", sync.syncId(), sync.batchNumber(),
                    missing);
            return false;
        }
        progress.invalidate(key);
        return true;
    }

    static String progressKey(EventEnvelope envelope, String syncId) {
        return envelope.getTenantId() + "|" + envelope.getIntegrationType() + "|" + envelope.getDataSourceId()
                + "|" + envelope.getEntityType().getWireName() + "|" + syncId;
    }

    /**
     * Syncs with linked batches still waiting for the rest of their pages.
     */
    public long getPendingSyncs() {
        progress.cleanUp();
        return progress.estimatedSize();
    }

    private int sweep(EventEnvelope envelope, String syncId) {
        Set<String> stale = new LinkedHashSet<>();
        for (Entity entity : entities.findBySource(envelope.getTenantId(), envelope.getIntegrationType(),
                envelope.getDataSourceId(), envelope.getEntityType())) {
            if (!entity.isDeleted() && !Objects.equals(syncId, entity.getSyncId())) {
                stale.add(entity.getId());
            }
        }
        if (stale.isEmpty()) {
            return 0;
        }

        Instant now = clock.instant();
        int deleted = entities.softDelete(envelope.getTenantId(), stale, now);
        Set<String> relationshipIds = new LinkedHashSet<>();
        for (Relationship relationship : relationships.findLiveTouching(envelope.getTenantId(), stale)) {
            relationshipIds.add(relationship.getId());
        }
        int unlinked = relationships.softDelete(envelope.getTenantId(), relationshipIds, now);
        log.info("cleanup.completed syncId={} entitiesDeleted={} relationshipsDeleted={}", syncId, deleted, unlinked);
        return deleted;
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.close();
        }
    }

    /**
     * Batch numbers (1-based) linked so far for one sync. Guarded by its own monitor.
     */
    private static final class SyncProgress {
        private final BitSet linked = new BitSet();
        private int finalBatch;
        private boolean swept;

        boolean record(int batchNumber, boolean isFinal) {
            linked.set(batchNumber);
            if (isFinal) {
                finalBatch = Math.max(finalBatch, batchNumber);
            }
            if (swept || finalBatch == 0 || missing() > 0) {
                return false;
            }
            swept = true;
            return true;
        }

        /**
         * Batches still missing below the final one, or -1 while the final batch is unknown.
         */
        int missing() {
            if (finalBatch == 0) {
                return -1;
            }
            return finalBatch - linked.get(1, finalBatch + 1).cardinality();
        }
    }
}
