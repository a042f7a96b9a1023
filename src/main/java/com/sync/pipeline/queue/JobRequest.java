package com.sync.pipeline.queue;

import com.sync.pipeline.core.model.EntityType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Job submission: what to run, for whom, how urgently, and which logical sync it belongs to.
 * The queue does not interpret {@code metadata}.
 */
public record JobRequest(
        String action,
        String tenantId,
        String integrationType,
        EntityType entityType,
        String dataSourceId,
        int priority,
        String syncId,
        Map<String, Object> metadata
) {
    public static final int DEFAULT_PRIORITY = 5;

    /** Metadata key: vendor cursor of the page to fetch. */
    public static final String META_CURSOR = "cursor";
    /** Metadata key: 1-based batch number within the sync. */
    public static final String META_BATCH_NUMBER = "batchNumber";
    /** Metadata key: id of the job a pipeline retry replaces. */
    public static final String META_RETRY_OF = "retryOf";
    /** Metadata key: number of pipeline-level retries already spent. */
    public static final String META_PIPELINE_RETRIES = "pipelineRetries";

    public JobRequest {
        Objects.requireNonNull(tenantId, "tenantId is required");
        Objects.requireNonNull(integrationType, "integrationType is required");
        Objects.requireNonNull(entityType, "entityType is required");
        action = action != null ? action : "sync." + entityType.getWireName();
        syncId = syncId != null ? syncId : UUID.randomUUID().toString();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    /**
     * Returns a copy with a fresh sync id, as used for every occurrence of a recurring job.
     */
    public JobRequest withNewSyncId() {
        return new JobRequest(action, tenantId, integrationType, entityType, dataSourceId, priority,
                UUID.randomUUID().toString(), metadata);
    }

    public Object metadataValue(String key) {
        return metadata.get(key);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String action;
        private String tenantId;
        private String integrationType;
        private EntityType entityType;
        private String dataSourceId;
        private int priority = DEFAULT_PRIORITY;
        private String syncId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder action(String action) {
            this.action = action;
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

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder dataSourceId(String dataSourceId) {
            this.dataSourceId = dataSourceId;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder syncId(String syncId) {
            this.syncId = syncId;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public JobRequest build() {
            return new JobRequest(action, tenantId, integrationType, entityType, dataSourceId,
                    priority, syncId, metadata);
        }
    }
}
