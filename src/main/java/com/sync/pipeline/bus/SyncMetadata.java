package com.sync.pipeline.bus;

import java.time.Instant;
import java.util.Objects;

/**
 * Correlates the batches of one logical sync.
 *
 * @param syncId      id shared by every batch of the sync
 * @param batchNumber 1-based batch number
 * @param finalBatch  true when no further page follows
 * @param cursor      vendor cursor this batch was fetched with, null for the first page
 * @param startedAt   when the job producing this batch started processing
 * @param jobId       queue job that produced this batch
 */
public record SyncMetadata(String syncId, int batchNumber, boolean finalBatch, String cursor,
                           Instant startedAt, String jobId) {

    public SyncMetadata {
        Objects.requireNonNull(syncId, "syncId is required");
        if (batchNumber < 1) {
            throw new IllegalArgumentException("batchNumber must be >= 1");
        }
    }

    public SyncMetadata withFinalBatch(boolean isFinal) {
        return new SyncMetadata(syncId, batchNumber, isFinal, cursor, startedAt, jobId);
    }
}
