package com.sync.pipeline.tracing;

import com.sync.pipeline.bus.EventEnvelope;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} on an OpenTelemetry {@link Tracer}.
 *
 * <p>Stage handlers consume bus messages, so their spans are {@link SpanKind#CONSUMER}
 * spans carrying the messaging attributes of the topic they were delivered on, next to
 * the pipeline lineage.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String MESSAGING_SYSTEM = "sync-pipeline";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return new StageSpan(builder(operationName, attributes).startSpan());
    }

    @Override
    public Span startSpan(String operationName, EventEnvelope envelope) {
        SpanBuilder builder = builder(operationName, TracingService.lineage(envelope));
        builder.setAttribute("messaging.system", MESSAGING_SYSTEM);
        builder.setAttribute("messaging.operation", "process");
        builder.setAttribute("messaging.destination.name", envelope.getTopic());
        builder.setAttribute("messaging.message.id", envelope.getEventId());
        Span span = new StageSpan(builder.startSpan());
        if (envelope.getPayload() != null) {
            span.recordBatch(envelope.getPayload().syncMetadata());
        }
        return span;
    }

    private SpanBuilder builder(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.CONSUMER);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return builder;
    }

    private static final class StageSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        private StageSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void fail(Throwable t) {
            delegate.recordException(t);
            delegate.setStatus(StatusCode.ERROR, String.valueOf(t.getMessage()));
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
