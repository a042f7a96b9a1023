package com.sync.pipeline.tracing;

import com.sync.pipeline.bus.EventEnvelope;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracing of stage runs. The default {@link NoOpTracingService} records nothing.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts the span of a stage handling {@code envelope}, tagged with its lineage and,
     * when the payload carries one, its sync page.
     */
    default Span startSpan(String operationName, EventEnvelope envelope) {
        Span span = startSpan(operationName, lineage(envelope));
        if (envelope.getPayload() != null) {
            span.recordBatch(envelope.getPayload().syncMetadata());
        }
        return span;
    }

    /**
     * Lineage attributes linking a span to the event chain of one sync.
     */
    static Map<String, String> lineage(EventEnvelope envelope) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("pipeline.traceId", envelope.getTraceId());
        attributes.put("pipeline.spanId", envelope.getSpanId());
        if (envelope.getParentEventId() != null) {
            attributes.put("pipeline.parentEventId", envelope.getParentEventId());
        }
        attributes.put("pipeline.topic", envelope.getTopic());
        attributes.put("pipeline.tenantId", envelope.getTenantId());
        attributes.put("pipeline.integrationType", envelope.getIntegrationType());
        attributes.put("pipeline.entityType", envelope.getEntityType().getWireName());
        if (envelope.getDataSourceId() != null) {
            attributes.put("pipeline.dataSourceId", envelope.getDataSourceId());
        }
        return attributes;
    }
}
