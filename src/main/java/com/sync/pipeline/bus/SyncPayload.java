package com.sync.pipeline.bus;

import java.util.Map;
import java.util.Objects;

/**
 * Request to fetch one page of one entity type, published by the job queue.
 */
public record SyncPayload(String jobId, String action, SyncMetadata syncMetadata,
                          Map<String, Object> metadata) implements EventPayload {

    public SyncPayload {
        Objects.requireNonNull(jobId, "jobId is required");
        Objects.requireNonNull(syncMetadata, "syncMetadata is required");
        metadata = metadata != null ? metadata : Map.of();
    }
}
