package com.sync.pipeline.store;

import com.sync.pipeline.core.model.Relationship;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Relationship queries used by the Link Stage and the Context Loader.
 */
public class RelationshipRepository {

    private final DocumentStore<Relationship> store;

    public RelationshipRepository(DocumentStore<Relationship> store) {
        this.store = store;
    }

    /**
     * Creates an in-memory relationship table enforcing {@code (source, target, type)} uniqueness.
     */
    public static InMemoryDocumentStore<Relationship> inMemoryStore() {
        return new InMemoryDocumentStore<>("relationships", Relationship::key);
    }

    public List<Relationship> findByDataSource(String tenantId, String dataSourceId, boolean includeDeleted) {
        return store.find(tenantId, r -> r.getDataSourceId().equals(dataSourceId)
                && (includeDeleted || !r.isDeleted()));
    }

    /**
     * Relationships of one type touching any of the given entities, as source or target,
     * including soft-deleted ones so they can be revived.
     */
    public List<Relationship> findTouching(String tenantId, String relationshipType, Set<String> entityIds) {
        if (entityIds.isEmpty()) {
            return List.of();
        }
        return store.find(tenantId, r -> r.getRelationshipType().equals(relationshipType)
                && (entityIds.contains(r.getSourceEntityId()) || entityIds.contains(r.getTargetEntityId())));
    }

    /**
     * Live relationships of any type touching the given entities.
     */
    public List<Relationship> findLiveTouching(String tenantId, Set<String> entityIds) {
        if (entityIds.isEmpty()) {
            return List.of();
        }
        return store.find(tenantId, r -> !r.isDeleted()
                && (entityIds.contains(r.getSourceEntityId()) || entityIds.contains(r.getTargetEntityId())));
    }

    public List<Relationship> insert(List<Relationship> relationships) {
        return relationships.isEmpty() ? relationships : store.insert(relationships);
    }

    public List<Relationship> update(List<Relationship> relationships) {
        return relationships.isEmpty() ? relationships : store.update(relationships);
    }

    public int softDelete(String tenantId, Collection<String> ids, Instant deletedAt) {
        return ids.isEmpty() ? 0 : store.softDelete(tenantId, ids, deletedAt);
    }

    public DocumentStore<Relationship> getStore() {
        return store;
    }
}
