package com.sync.pipeline.core.model;

import com.sync.pipeline.store.SoftDeletable;
import com.sync.pipeline.store.TenantDocument;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * A normalized entity as persisted by the Normalize Stage.
 *
 * <p>Instances are immutable; changes are made through {@link #toBuilder()}.
 * {@code (tenantId, integrationType, dataSourceId, entityType, externalId)} is unique,
 * see {@link #key()}.</p>
 */
public final class Entity implements TenantDocument, SoftDeletable<Entity> {

    private final String id;
    private final String tenantId;
    private final String integrationType;
    private final String dataSourceId;
    private final EntityType entityType;
    private final String externalId;
    private final String dataHash;
    private final String siteId;
    private final Map<String, Object> normalizedData;
    private final Map<String, Object> rawData;
    private final Set<String> tags;
    private final EntityState state;
    private final String syncId;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant deletedAt;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.integrationType = Objects.requireNonNull(builder.integrationType, "integrationType is required");
        this.dataSourceId = Objects.requireNonNull(builder.dataSourceId, "dataSourceId is required");
        this.entityType = Objects.requireNonNull(builder.entityType, "entityType is required");
        this.externalId = Objects.requireNonNull(builder.externalId, "externalId is required");
        this.dataHash = Objects.requireNonNull(builder.dataHash, "dataHash is required");
        this.siteId = builder.siteId;
        this.normalizedData = copy(builder.normalizedData);
        this.rawData = copy(builder.rawData);
        this.tags = builder.tags != null
                ? Collections.unmodifiableSet(new TreeSet<>(builder.tags))
                : Set.of();
        this.state = builder.state;
        this.syncId = builder.syncId;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.deletedAt = builder.deletedAt;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        // vendor payloads may carry null values, which Map.copyOf rejects
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    public String getIntegrationType() {
        return integrationType;
    }

    public String getDataSourceId() {
        return dataSourceId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getDataHash() {
        return dataHash;
    }

    public String getSiteId() {
        return siteId;
    }

    public Map<String, Object> getNormalizedData() {
        return normalizedData;
    }

    public Map<String, Object> getRawData() {
        return rawData;
    }

    public Set<String> getTags() {
        return tags;
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public EntityState getState() {
        return state;
    }

    public String getSyncId() {
        return syncId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public Instant getDeletedAt() {
        return deletedAt;
    }

    /**
     * Convenience accessor for a string field of the normalized data.
     */
    public String getString(String field) {
        Object value = normalizedData.get(field);
        return value != null ? value.toString() : null;
    }

    /**
     * Returns the uniqueness key of this entity.
     */
    public Key key() {
        return new Key(tenantId, integrationType, dataSourceId, entityType, externalId);
    }

    @Override
    public Entity markDeleted(Instant deletedAt) {
        return toBuilder().deletedAt(deletedAt).updatedAt(deletedAt).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tenantId(tenantId)
                .integrationType(integrationType)
                .dataSourceId(dataSourceId)
                .entityType(entityType)
                .externalId(externalId)
                .dataHash(dataHash)
                .siteId(siteId)
                .normalizedData(normalizedData)
                .rawData(rawData)
                .tags(tags)
                .state(state)
                .syncId(syncId)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .deletedAt(deletedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", type=" + entityType +
                ", externalId='" + externalId + '\'' +
                ", integrationType='" + integrationType + '\'' +
                ", tags=" + tags +
                ", deleted=" + isDeleted() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Uniqueness key of a persisted entity.
     */
    public record Key(String tenantId, String integrationType, String dataSourceId,
                      EntityType entityType, String externalId) {
    }

    public static class Builder {
        private String id;
        private String tenantId;
        private String integrationType;
        private String dataSourceId;
        private EntityType entityType;
        private String externalId;
        private String dataHash;
        private String siteId;
        private Map<String, Object> normalizedData;
        private Map<String, Object> rawData;
        private Set<String> tags;
        private EntityState state;
        private String syncId;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant deletedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder integrationType(String integrationType) {
            this.integrationType = integrationType;
            return this;
        }

        public Builder dataSourceId(String dataSourceId) {
            this.dataSourceId = dataSourceId;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder dataHash(String dataHash) {
            this.dataHash = dataHash;
            return this;
        }

        public Builder siteId(String siteId) {
            this.siteId = siteId;
            return this;
        }

        public Builder normalizedData(Map<String, Object> normalizedData) {
            this.normalizedData = normalizedData;
            return this;
        }

        public Builder rawData(Map<String, Object> rawData) {
            this.rawData = rawData;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder state(EntityState state) {
            this.state = state;
            return this;
        }

        public Builder syncId(String syncId) {
            this.syncId = syncId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public Entity build() {
            return new Entity(this);
        }
    }
}
