package com.sync.pipeline.analysis.workflow;

import com.sync.pipeline.core.model.EntityType;

import java.util.Objects;
import java.util.Set;

/**
 * What triggered an analysis run.
 *
 * @param changedTypes     entity types with changes in the triggering batches
 * @param changedEntityIds entities created, updated or relinked by the triggering batches
 * @param finalBatch       true when the run follows the last batch of the sync
 */
public record AnalysisScope(String tenantId, String integrationType, String dataSourceId, String syncId,
                            Set<EntityType> changedTypes, Set<String> changedEntityIds, boolean finalBatch) {

    public AnalysisScope {
        Objects.requireNonNull(tenantId, "tenantId is required");
        Objects.requireNonNull(integrationType, "integrationType is required");
        changedTypes = changedTypes != null ? Set.copyOf(changedTypes) : Set.of();
        changedEntityIds = changedEntityIds != null ? Set.copyOf(changedEntityIds) : Set.of();
    }

    public boolean hasChanges() {
        return !changedEntityIds.isEmpty();
    }
}
