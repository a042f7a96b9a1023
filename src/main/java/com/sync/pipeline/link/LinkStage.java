package com.sync.pipeline.link;

import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.FailedPayload;
import com.sync.pipeline.bus.LinkedPayload;
import com.sync.pipeline.bus.MessageBus;
import com.sync.pipeline.bus.ProcessedPayload;
import com.sync.pipeline.bus.Subscription;
import com.sync.pipeline.bus.Topic;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Relationship;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.history.JobMetrics;
import com.sync.pipeline.lock.DistributedLock;
import com.sync.pipeline.logging.LogContext;
import com.sync.pipeline.metrics.MetricsService;
import com.sync.pipeline.store.EntityRepository;
import com.sync.pipeline.store.RelationshipRepository;
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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Link stage: derives relationships from the {@link LinkRule}s of the event's integration.
 *
 * <p>For changed entities holding a rule field, references are resolved by external id,
 * missing relationships are created, soft-deleted ones revived and those no longer
 * referenced pruned. For changed entities that are referenced by a rule, holders stored
 * earlier are linked to them, which covers targets arriving after their sources.
 * A {@code linked} event is published for every processed batch, listing the changed
 * entities and every entity whose relationships changed.</p>
 */
public class LinkStage implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LinkStage.class);

    private final LinkRules rules;
    private final EntityRepository entities;
    private final RelationshipRepository relationships;
    private final DistributedLock lock;
    private final MessageBus bus;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;
    private Subscription subscription;

    public LinkStage(LinkRules rules, EntityRepository entities, RelationshipRepository relationships,
                     DistributedLock lock, MessageBus bus, MetricsService metricsService,
                     TracingService tracingService, Clock clock) {
        this.rules = rules;
        this.entities = entities;
        this.relationships = relationships;
        this.lock = lock;
        this.bus = bus;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.clock = clock;
    }

    public LinkStage subscribe() {
        this.subscription = bus.subscribe(Topic.allOf(Stage.PROCESSED), this::handle);
        log.info("stage.subscribed stage=link");
        return this;
    }

    void handle(EventEnvelope envelope) {
        ProcessedPayload processed = envelope.payloadAs(ProcessedPayload.class);
        try (TenantContext.TenantScope tenant = TenantContext.scoped(envelope.getTenantId());
             LogContext ctx = LogContext.forEvent(envelope);
             Span span = tracingService.startSpan("pipeline.link", envelope)) {

            long startNanos = System.nanoTime();
            JobMetrics metrics = processed.metrics().copy();
            LinkResult result;
            try {
                if (processed.changedEntityIds().isEmpty() || envelope.getDataSourceId() == null) {
                    result = new LinkResult();
                } else {
                    String lockKey = DistributedLock.key("link", envelope.getTenantId(), envelope.getDataSourceId());
                    result = lock.withLock(lockKey, () -> link(envelope, processed.changedEntityIds(), metrics));
                }
            } catch (RuntimeException e) {
                span.fail(e);
                metrics.recordError(e.getMessage(), e);
                log.error("link.failed error={}", e.getMessage(), e);
                bus.publish(envelope.next(Stage.FAILED, new FailedPayload(
                        new FailedPayload.ErrorInfo(e.getMessage(), true), Stage.LINKED, clock.instant(),
                        processed.syncMetadata(), metrics)));
                return;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            int changedRelationships = result.created + result.updated + result.removed;
            metrics.recordStageTime(JobMetrics.Phase.LINK, elapsed.toMillis());
            metrics.addRelationshipsChanged(changedRelationships);
            metricsService.recordStageDuration(Stage.LINKED, envelope.getEntityType(), elapsed);
            metricsService.incrementRelationshipsChanged(changedRelationships);

            Set<String> changedIds = new LinkedHashSet<>(processed.changedEntityIds());
            changedIds.addAll(result.touchedEntityIds);
            bus.publish(envelope.next(Stage.LINKED, new LinkedPayload(result.created, result.updated,
                    result.removed, new ArrayList<>(changedIds), processed.syncMetadata(), metrics)));
            span.setAttribute("relationshipsChanged", changedRelationships);
            span.setStatus(Span.SpanStatus.OK);
            log.info("link.completed created={} revived={} removed={} durationMs={}",
                    result.created, result.updated, result.removed, elapsed.toMillis());
        }
    }

    private LinkResult link(EventEnvelope envelope, List<String> changedEntityIds, JobMetrics metrics) {
        String tenantId = envelope.getTenantId();
        String dataSourceId = envelope.getDataSourceId();
        EntityType entityType = envelope.getEntityType();
        LinkResult result = new LinkResult();

        List<LinkRule> held = rules.heldBy(envelope.getIntegrationType(), entityType);
        List<LinkRule> referencing = rules.referencing(envelope.getIntegrationType(), entityType);
        if (held.isEmpty() && referencing.isEmpty()) {
            return result;
        }

        List<Entity> changed = entities.findByIds(tenantId, changedEntityIds).stream()
                .filter(e -> !e.isDeleted() && e.getEntityType() == entityType)
                .toList();
        metrics.addQueries(1);

        for (LinkRule rule : held) {
            linkHolders(tenantId, dataSourceId, rule, changed, metrics, result);
        }
        for (LinkRule rule : referencing) {
            linkReferenced(tenantId, dataSourceId, rule, changed, metrics, result);
        }
        return result;
    }

    /**
     * Brings the relationships of changed holders in line with their references.
     */
    private void linkHolders(String tenantId, String dataSourceId, LinkRule rule, List<Entity> holders,
                             JobMetrics metrics, LinkResult result) {
        if (holders.isEmpty()) {
            return;
        }
        Set<String> allRefs = new HashSet<>();
        holders.forEach(h -> allRefs.addAll(rule.references(h)));
        Map<String, Entity> others = byExternalId(
                entities.findByExternalIds(tenantId, dataSourceId, rule.otherType(), allRefs));
        metrics.addQueries(1);

        Set<String> holderIds = holders.stream().map(Entity::getId).collect(Collectors.toSet());
        Map<Relationship.Key, Relationship> existing = new HashMap<>();
        for (Relationship r : relationships.findTouching(tenantId, rule.relationshipType(), holderIds)) {
            String holderSide = rule.holderIsSource() ? r.getSourceEntityId() : r.getTargetEntityId();
            EntityType otherSideType = rule.holderIsSource() ? r.getTargetEntityType() : r.getSourceEntityType();
            if (holderIds.contains(holderSide) && otherSideType == rule.otherType()) {
                existing.put(r.key(), r);
            }
        }
        metrics.addQueries(1);

        Map<Relationship.Key, Relationship> desired = new LinkedHashMap<>();
        int unresolved = 0;
        for (Entity holder : holders) {
            for (String ref : rule.references(holder)) {
                Entity other = others.get(ref);
                if (other == null) {
                    unresolved++;
                    continue;
                }
                Relationship relationship = newRelationship(tenantId, dataSourceId, rule, holder, other);
                desired.putIfAbsent(relationship.key(), relationship);
            }
        }
        if (unresolved > 0) {
            log.debug("link.unresolved field={} count={}", rule.field(), unresolved);
        }
        apply(tenantId, desired, existing, true, metrics, result);
    }

    /**
     * Links holders stored earlier to changed entities they reference.
     */
    private void linkReferenced(String tenantId, String dataSourceId, LinkRule rule, List<Entity> referenced,
                                JobMetrics metrics, LinkResult result) {
        if (referenced.isEmpty()) {
            return;
        }
        Map<String, Entity> byExternal = byExternalId(referenced);
        List<Entity> holders = entities.findByDataSource(tenantId, dataSourceId, rule.holderType(), false).stream()
                .filter(h -> rule.references(h).stream().anyMatch(byExternal::containsKey))
                .toList();
        metrics.addQueries(1);
        if (holders.isEmpty()) {
            return;
        }

        Set<String> referencedIds = referenced.stream().map(Entity::getId).collect(Collectors.toSet());
        Map<Relationship.Key, Relationship> existing = new HashMap<>();
        for (Relationship r : relationships.findTouching(tenantId, rule.relationshipType(), referencedIds)) {
            existing.put(r.key(), r);
        }
        metrics.addQueries(1);

        Map<Relationship.Key, Relationship> desired = new LinkedHashMap<>();
        for (Entity holder : holders) {
            for (String ref : rule.references(holder)) {
                Entity other = byExternal.get(ref);
                if (other != null) {
                    Relationship relationship = newRelationship(tenantId, dataSourceId, rule, holder, other);
                    desired.putIfAbsent(relationship.key(), relationship);
                }
            }
        }
        apply(tenantId, desired, existing, false, metrics, result);
    }

    private void apply(String tenantId, Map<Relationship.Key, Relationship> desired,
                       Map<Relationship.Key, Relationship> existing, boolean prune,
                       JobMetrics metrics, LinkResult result) {
        Instant now = clock.instant();
        List<Relationship> toInsert = new ArrayList<>();
        List<Relationship> toRevive = new ArrayList<>();
        for (Map.Entry<Relationship.Key, Relationship> entry : desired.entrySet()) {
            Relationship current = existing.get(entry.getKey());
            if (current == null) {
                toInsert.add(entry.getValue());
            } else if (current.isDeleted()) {
                toRevive.add(current.toBuilder().deletedAt(null).updatedAt(now).build());
            }
        }
        List<Relationship> toPrune = new ArrayList<>();
        if (prune) {
            for (Relationship r : existing.values()) {
                if (!r.isDeleted() && !desired.containsKey(r.key())) {
                    toPrune.add(r);
                }
            }
        }

        if (!toInsert.isEmpty()) {
            relationships.insert(toInsert);
            metrics.addMutations(1);
        }
        if (!toRevive.isEmpty()) {
            relationships.update(toRevive);
            metrics.addMutations(1);
        }
        if (!toPrune.isEmpty()) {
            relationships.softDelete(tenantId, toPrune.stream().map(Relationship::getId).toList(), now);
            metrics.addMutations(1);
        }

        result.created += toInsert.size();
        result.updated += toRevive.size();
        result.removed += toPrune.size();
        for (List<Relationship> changed : List.of(toInsert, toRevive, toPrune)) {
            for (Relationship r : changed) {
                result.touchedEntityIds.add(r.getSourceEntityId());
                result.touchedEntityIds.add(r.getTargetEntityId());
            }
        }
    }

    private Relationship newRelationship(String tenantId, String dataSourceId, LinkRule rule,
                                         Entity holder, Entity other) {
        Entity source = rule.holderIsSource() ? holder : other;
        Entity target = rule.holderIsSource() ? other : holder;
        Instant now = clock.instant();
        return Relationship.builder()
                .tenantId(tenantId)
                .dataSourceId(dataSourceId)
                .sourceEntityType(source.getEntityType())
                .sourceEntityId(source.getId())
                .targetEntityType(target.getEntityType())
                .targetEntityId(target.getId())
                .relationshipType(rule.relationshipType())
                .metadata(Map.of("field", rule.field()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static Map<String, Entity> byExternalId(List<Entity> list) {
        return list.stream().collect(Collectors.toMap(Entity::getExternalId, Function.identity(), (a, b) -> a));
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.close();
        }
    }

    private static final class LinkResult {
        private int created;
        private int updated;
        private int removed;
        private final Set<String> touchedEntityIds = new LinkedHashSet<>();
    }
}
