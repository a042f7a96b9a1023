package com.sync.pipeline.bus;

import com.sync.pipeline.history.JobMetrics;

import java.util.List;

/**
 * Outcome of linking one batch. {@code changedEntityIds} carries the entities changed upstream
 * plus every entity whose relationships changed.
 */
public record LinkedPayload(int relationshipsCreated, int relationshipsUpdated, int relationshipsRemoved,
                            List<String> changedEntityIds, SyncMetadata syncMetadata,
                            JobMetrics metrics) implements EventPayload {

    public LinkedPayload {
        changedEntityIds = changedEntityIds != null ? List.copyOf(changedEntityIds) : List.of();
        metrics = metrics != null ? metrics : new JobMetrics();
    }
}
