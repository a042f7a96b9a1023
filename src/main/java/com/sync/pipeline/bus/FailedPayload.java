package com.sync.pipeline.bus;

import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.history.JobMetrics;

import java.time.Instant;
import java.util.Objects;

/**
 * Batch-level failure of a stage.
 */
public record FailedPayload(ErrorInfo error, Stage failedStage, Instant failedAt,
                            SyncMetadata syncMetadata, JobMetrics metrics) implements EventPayload {

    public FailedPayload {
        Objects.requireNonNull(error, "error is required");
        failedAt = failedAt != null ? failedAt : Instant.now();
        metrics = metrics != null ? metrics : new JobMetrics();
    }

    /**
     * @param message   human readable failure
     * @param retryable whether a fresh attempt may succeed
     */
    public record ErrorInfo(String message, boolean retryable) {
    }
}
