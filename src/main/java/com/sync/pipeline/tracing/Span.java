package com.sync.pipeline.tracing;

import com.sync.pipeline.bus.SyncMetadata;

/**
 * A traced stage run. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("pipeline.normalize", envelope)) {
 *     span.setAttribute("changed", changedIds.size());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    String ATTR_SYNC_ID = "pipeline.syncId";
    String ATTR_BATCH_NUMBER = "pipeline.batchNumber";
    String ATTR_FINAL_BATCH = "pipeline.finalBatch";

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Marks the stage run as failed with the given cause.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    /**
     * Tags the span with the page of the sync it handles.
     */
    default void recordBatch(SyncMetadata sync) {
        if (sync == null) {
            return;
        }
        setAttribute(ATTR_SYNC_ID, sync.syncId());
        setAttribute(ATTR_BATCH_NUMBER, sync.batchNumber());
        setAttribute(ATTR_FINAL_BATCH, String.valueOf(sync.finalBatch()));
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
