package com.sync.pipeline.store;

import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Entity queries used by the stages, each issued as a single bulk read.
 */
public class EntityRepository {

    private final DocumentStore<Entity> store;

    public EntityRepository(DocumentStore<Entity> store) {
        this.store = store;
    }

    /**
     * Creates an in-memory entity table enforcing the entity uniqueness key.
     */
    public static InMemoryDocumentStore<Entity> inMemoryStore() {
        return new InMemoryDocumentStore<>("entities", Entity::key);
    }

    /**
     * All entities, including soft-deleted ones, of one integration, data source and type.
     */
    public List<Entity> findBySource(String tenantId, String integrationType, String dataSourceId,
                                     EntityType entityType) {
        return store.find(tenantId, e -> e.getEntityType() == entityType
                && e.getIntegrationType().equals(integrationType)
                && e.getDataSourceId().equals(dataSourceId));
    }

    /**
     * Entities of one type for a data source.
     */
    public List<Entity> findByDataSource(String tenantId, String dataSourceId, EntityType entityType,
                                         boolean includeDeleted) {
        return store.find(tenantId, e -> e.getEntityType() == entityType
                && e.getDataSourceId().equals(dataSourceId)
                && (includeDeleted || !e.isDeleted()));
    }

    /**
     * Live entities of one type whose external id is in the given set.
     */
    public List<Entity> findByExternalIds(String tenantId, String dataSourceId, EntityType entityType,
                                          Set<String> externalIds) {
        if (externalIds.isEmpty()) {
            return List.of();
        }
        return store.find(tenantId, e -> e.getEntityType() == entityType
                && e.getDataSourceId().equals(dataSourceId)
                && !e.isDeleted()
                && externalIds.contains(e.getExternalId()));
    }

    public List<Entity> findByIds(String tenantId, Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return store.getMany(tenantId, ids);
    }

    public List<Entity> insert(List<Entity> entities) {
        return entities.isEmpty() ? entities : store.insert(entities);
    }

    public List<Entity> update(List<Entity> entities) {
        return entities.isEmpty() ? entities : store.update(entities);
    }

    public int softDelete(String tenantId, Collection<String> ids, Instant deletedAt) {
        return ids.isEmpty() ? 0 : store.softDelete(tenantId, ids, deletedAt);
    }

    public DocumentStore<Entity> getStore() {
        return store;
    }
}
