package com.sync.pipeline.queue;

import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.MessageBus;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.SyncPayload;
import com.sync.pipeline.core.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a processing job into a sync event on {@code {integrationType}.sync.{entityType}}.
 * The job id becomes the parent of the event lineage.
 */
public class BusJobDispatcher implements JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(BusJobDispatcher.class);

    private final MessageBus bus;

    public BusJobDispatcher(MessageBus bus) {
        this.bus = bus;
    }

    @Override
    public void dispatch(Job job) {
        JobRequest request = job.getRequest();
        SyncMetadata syncMetadata = new SyncMetadata(
                request.syncId(),
                batchNumber(request),
                false,
                cursor(request),
                job.getStartedAt(),
                job.getId());
        EventEnvelope envelope = EventEnvelope.root(job.getId(), request.tenantId(), request.integrationType(),
                request.entityType(), request.dataSourceId(), Stage.SYNC,
                new SyncPayload(job.getId(), request.action(), syncMetadata, request.metadata()));
        bus.publish(envelope);
        log.debug("job.dispatched topic={} eventId={} batch={}",
                envelope.getTopic(), envelope.getEventId(), syncMetadata.batchNumber());
    }

    public static int batchNumber(JobRequest request) {
        Object value = request.metadataValue(JobRequest.META_BATCH_NUMBER);
        if (value instanceof Number number) {
            return Math.max(1, number.intValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            return Math.max(1, Integer.parseInt(text.trim()));
        }
        return 1;
    }

    static String cursor(JobRequest request) {
        Object value = request.metadataValue(JobRequest.META_CURSOR);
        return value != null ? value.toString() : null;
    }
}
