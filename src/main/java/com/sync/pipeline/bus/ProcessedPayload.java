package com.sync.pipeline.bus;

import com.sync.pipeline.history.JobMetrics;

import java.util.List;

/**
 * Outcome of normalizing one batch. {@code changedEntityIds} lists only created or updated entities.
 */
public record ProcessedPayload(int created, int updated, int unchanged, int skipped,
                               List<String> changedEntityIds, SyncMetadata syncMetadata,
                               JobMetrics metrics) implements EventPayload {

    public ProcessedPayload {
        changedEntityIds = changedEntityIds != null ? List.copyOf(changedEntityIds) : List.of();
        metrics = metrics != null ? metrics : new JobMetrics();
    }
}
