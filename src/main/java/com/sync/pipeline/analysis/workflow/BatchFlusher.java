package com.sync.pipeline.analysis.workflow;

import com.sync.pipeline.alert.AlertService;
import com.sync.pipeline.analysis.context.AnalysisContext;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityState;
import com.sync.pipeline.lock.DistributedLock;
import com.sync.pipeline.normalize.NormalizeStage;
import com.sync.pipeline.store.EntityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Writes a {@link DeferredBatch}: one alert reconciliation, then one entity update per source
 * and entity type.
 *
 * <p>Entity writes re-read the affected entities under the same lock the Normalize Stage
 * holds for that scope, so tags and state derived by analysis are applied to the latest
 * stored version.</p>
 */
public class BatchFlusher {
    private static final Logger log = LoggerFactory.getLogger(BatchFlusher.class);

    private final EntityRepository entities;
    private final AlertService alertService;
    private final DistributedLock lock;
    private final Clock clock;

    public BatchFlusher(EntityRepository entities, AlertService alertService, DistributedLock lock, Clock clock) {
        this.entities = entities;
        this.alertService = alertService;
        this.lock = lock;
        this.clock = clock;
    }

    public FlushResult flush(AnalysisContext context, DeferredBatch batch) {
        if (batch.isEmpty()) {
            return new FlushResult(0, new AlertService.ReconcileResult(0, 0, 0));
        }

        // alerts first: a failed reconciliation leaves entities untouched, so a retry re-derives both
        AlertService.ReconcileResult alerts = batch.getEvaluatedAlertTypes().isEmpty()
                ? new AlertService.ReconcileResult(0, 0, 0)
                : alertService.reconcile(context.getTenantId(), context.getDataSourceId(),
                        batch.getEvaluatedAlertTypes(), batch.getAlerts(), batch.getResolvedFingerprints());

        Map<String, List<String>> idsByScope = new LinkedHashMap<>();
        for (String id : batch.getTouchedEntityIds()) {
            context.getEntity(id).ifPresent(entity -> idsByScope
                    .computeIfAbsent(NormalizeStage.lockKey(entity.getTenantId(), entity.getIntegrationType(),
                            entity.getDataSourceId(), entity.getEntityType()), k -> new ArrayList<>())
                    .add(id));
        }

        int updated = 0;
        for (Map.Entry<String, List<String>> scope : idsByScope.entrySet()) {
            updated += lock.withLock(scope.getKey(),
                    () -> applyEntityChanges(context.getTenantId(), scope.getValue(), batch));
        }

        log.debug("batch.flushed mutations={} entitiesUpdated={}", batch.size(), updated);
        return new FlushResult(updated, alerts);
    }

    private int applyEntityChanges(String tenantId, List<String> ids, DeferredBatch batch) {
        Instant now = clock.instant();
        List<Entity> changed = new ArrayList<>();
        for (Entity stored : entities.findByIds(tenantId, ids)) {
            if (stored.isDeleted()) {
                continue;
            }
            Set<String> tags = batch.effectiveTags(stored);
            EntityState state = batch.stateOf(stored.getId()).orElse(stored.getState());
            if (tags.equals(stored.getTags()) && Objects.equals(state, stored.getState())) {
                continue;
            }
            changed.add(stored.toBuilder().tags(tags).state(state).updatedAt(now).build());
        }
        entities.update(changed);
        return changed.size();
    }

    /**
     * Counts of one flush.
     */
    public record FlushResult(int entitiesUpdated, AlertService.ReconcileResult alerts) {
    }
}
