package com.sync.pipeline.analysis.context;

import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Relationship;
import com.sync.pipeline.link.RelationshipTypes;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only snapshot of one tenant's data source, indexed for constant-time lookups.
 *
 * <p>Built once per analysis run by {@link ContextLoader} and discarded afterwards.
 * Relationship maps exist per relationship type in both directions: forward maps go from
 * source to targets, reverse maps from target to sources.</p>
 */
public final class AnalysisContext {

    private static final RelationshipMap EMPTY = new RelationshipMap();

    private final String tenantId;
    private final String dataSourceId;
    private final Map<EntityType, List<Entity>> entitiesByType;
    private final Map<String, Entity> entitiesById = new HashMap<>();
    private final Map<EntityType, Map<String, Entity>> entitiesByExternalId = new EnumMap<>(EntityType.class);
    private final Map<String, RelationshipMap> forward = new HashMap<>();
    private final Map<String, RelationshipMap> reverse = new HashMap<>();
    private final int relationshipCount;
    private final LoadStats stats;

    AnalysisContext(String tenantId, String dataSourceId, Map<EntityType, List<Entity>> entitiesByType,
                    List<Relationship> relationships, LoadStats stats) {
        this.tenantId = tenantId;
        this.dataSourceId = dataSourceId;
        Map<EntityType, List<Entity>> copy = new EnumMap<>(EntityType.class);
        entitiesByType.forEach((type, list) -> copy.put(type, List.copyOf(list)));
        this.entitiesByType = Collections.unmodifiableMap(copy);

        for (Map.Entry<EntityType, List<Entity>> entry : copy.entrySet()) {
            Map<String, Entity> byExternal = new HashMap<>();
            for (Entity entity : entry.getValue()) {
                entitiesById.put(entity.getId(), entity);
                byExternal.put(entity.getExternalId(), entity);
            }
            entitiesByExternalId.put(entry.getKey(), byExternal);
        }

        int count = 0;
        for (Relationship r : relationships) {
            if (r.isDeleted()) {
                continue;
            }
            forward.computeIfAbsent(r.getRelationshipType(), k -> new RelationshipMap())
                    .add(r.getSourceEntityId(), r.getTargetEntityId());
            reverse.computeIfAbsent(r.getRelationshipType(), k -> new RelationshipMap())
                    .add(r.getTargetEntityId(), r.getSourceEntityId());
            count++;
        }
        this.relationshipCount = count;
        this.stats = stats;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getDataSourceId() {
        return dataSourceId;
    }

    public List<Entity> entities(EntityType type) {
        return entitiesByType.getOrDefault(type, List.of());
    }

    public Optional<Entity> getEntity(String id) {
        return Optional.ofNullable(entitiesById.get(id));
    }

    public Optional<Entity> getByExternalId(EntityType type, String externalId) {
        return Optional.ofNullable(entitiesByExternalId.getOrDefault(type, Map.of()).get(externalId));
    }

    /**
     * Source to targets for a relationship type.
     */
    public RelationshipMap forward(String relationshipType) {
        return forward.getOrDefault(relationshipType, EMPTY);
    }

    /**
     * Target to sources for a relationship type.
     */
    public RelationshipMap reverse(String relationshipType) {
        return reverse.getOrDefault(relationshipType, EMPTY);
    }

    public Set<String> groupsOf(String identityId) {
        return forward(RelationshipTypes.MEMBER_OF).get(identityId);
    }

    public Set<String> membersOf(String groupId) {
        return reverse(RelationshipTypes.MEMBER_OF).get(groupId);
    }

    public Set<String> rolesOf(String identityId) {
        return forward(RelationshipTypes.ASSIGNED_ROLE).get(identityId);
    }

    public Set<String> roleMembers(String roleId) {
        return reverse(RelationshipTypes.ASSIGNED_ROLE).get(roleId);
    }

    public Set<String> licensesOf(String identityId) {
        return reverse(RelationshipTypes.HAS_LICENSE).get(identityId);
    }

    public Set<String> policyTargets(String policyId) {
        return forward(RelationshipTypes.APPLIES_TO).get(policyId);
    }

    public int getEntityCount() {
        return entitiesById.size();
    }

    public int getRelationshipCount() {
        return relationshipCount;
    }

    public LoadStats getStats() {
        return stats;
    }
}
