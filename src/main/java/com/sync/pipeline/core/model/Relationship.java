package com.sync.pipeline.core.model;

import com.sync.pipeline.store.SoftDeletable;
import com.sync.pipeline.store.TenantDocument;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Directed relationship between two normalized entities, maintained by the Link Stage.
 *
 * <p>Many-to-many; the only invariant is that {@code (source, target, relationshipType)}
 * is unique among live relationships, see {@link #key()}.</p>
 */
public final class Relationship implements TenantDocument, SoftDeletable<Relationship> {

    private final String id;
    private final String tenantId;
    private final String dataSourceId;
    private final EntityType sourceEntityType;
    private final String sourceEntityId;
    private final EntityType targetEntityType;
    private final String targetEntityId;
    private final String relationshipType;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant deletedAt;

    private Relationship(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.dataSourceId = Objects.requireNonNull(builder.dataSourceId, "dataSourceId is required");
        this.sourceEntityType = Objects.requireNonNull(builder.sourceEntityType, "sourceEntityType is required");
        this.sourceEntityId = Objects.requireNonNull(builder.sourceEntityId, "sourceEntityId is required");
        this.targetEntityType = Objects.requireNonNull(builder.targetEntityType, "targetEntityType is required");
        this.targetEntityId = Objects.requireNonNull(builder.targetEntityId, "targetEntityId is required");
        this.relationshipType = Objects.requireNonNull(builder.relationshipType, "relationshipType is required");
        this.metadata = builder.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
                : Map.of();
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.deletedAt = builder.deletedAt;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    public String getDataSourceId() {
        return dataSourceId;
    }

    public EntityType getSourceEntityType() {
        return sourceEntityType;
    }

    public String getSourceEntityId() {
        return sourceEntityId;
    }

    public EntityType getTargetEntityType() {
        return targetEntityType;
    }

    public String getTargetEntityId() {
        return targetEntityId;
    }

    public String getRelationshipType() {
        return relationshipType;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
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

    public Key key() {
        return new Key(sourceEntityId, targetEntityId, relationshipType);
    }

    @Override
    public Relationship markDeleted(Instant deletedAt) {
        return toBuilder().deletedAt(deletedAt).updatedAt(deletedAt).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tenantId(tenantId)
                .dataSourceId(dataSourceId)
                .sourceEntityType(sourceEntityType)
                .sourceEntityId(sourceEntityId)
                .targetEntityType(targetEntityType)
                .targetEntityId(targetEntityId)
                .relationshipType(relationshipType)
                .metadata(metadata)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .deletedAt(deletedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id='" + id + '\'' +
                ", sourceEntityId='" + sourceEntityId + '\'' +
                ", targetEntityId='" + targetEntityId + '\'' +
                ", type='" + relationshipType + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Identity of a relationship edge: source, target and type.
     */
    public record Key(String sourceEntityId, String targetEntityId, String relationshipType) {
    }

    public static class Builder {
        private String id;
        private String tenantId;
        private String dataSourceId;
        private EntityType sourceEntityType;
        private String sourceEntityId;
        private EntityType targetEntityType;
        private String targetEntityId;
        private String relationshipType;
        private Map<String, Object> metadata;
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

        public Builder dataSourceId(String dataSourceId) {
            this.dataSourceId = dataSourceId;
            return this;
        }

        public Builder sourceEntityType(EntityType sourceEntityType) {
            this.sourceEntityType = sourceEntityType;
            return this;
        }

        public Builder sourceEntityId(String sourceEntityId) {
            this.sourceEntityId = sourceEntityId;
            return this;
        }

        public Builder targetEntityType(EntityType targetEntityType) {
            this.targetEntityType = targetEntityType;
            return this;
        }

        public Builder targetEntityId(String targetEntityId) {
            this.targetEntityId = targetEntityId;
            return this;
        }

        public Builder relationshipType(String relationshipType) {
            this.relationshipType = relationshipType;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
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

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
