package com.sync.pipeline.tracing;

import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.SyncPayload;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    private static EventEnvelope envelope() {
        return EventEnvelope.root("job-1", "tenant-a", "microsoft-365", EntityType.GROUPS, "ds-1", Stage.SYNC,
                new SyncPayload("job-1", "sync.groups",
                        new SyncMetadata("sync-1", 2, false, "cursor-2", Instant.now(), "job-1"), Map.of()));
    }

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("pipeline.fetch")) {
                    span.setAttribute("key", "value");
                    span.setAttribute("records", 42L);
                    span.setStatus(Span.SpanStatus.OK);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("op1"), noOp.startSpan("op2", Map.of("k", "v")));
            assertSame(noOp.startSpan("op1"), noOp.startSpan("pipeline.link", envelope()));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.setSpanKind(any())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
        }

        @Test
        @DisplayName("Should start consumer spans")
        void consumerSpan() {
            Span span = new OpenTelemetryTracingService(tracer).startSpan("pipeline.normalize");

            assertNotNull(span);
            verify(tracer).spanBuilder("pipeline.normalize");
            verify(builder).setSpanKind(SpanKind.CONSUMER);
        }

        @Test
        @DisplayName("Should carry event lineage as attributes")
        void lineageAttributes() {
            EventEnvelope envelope = EventEnvelope.root("job-1", "tenant-a", "microsoft-365", EntityType.GROUPS,
                    "ds-1", Stage.SYNC, new SyncPayload("job-1", "sync.groups",
                            new SyncMetadata("sync-1", 1, true, null, Instant.now(), "job-1"), Map.of()));

            new OpenTelemetryTracingService(tracer).startSpan("pipeline.fetch", envelope);

            verify(builder).setAttribute("pipeline.traceId", envelope.getTraceId());
            verify(builder).setAttribute("pipeline.tenantId", "tenant-a");
            verify(builder).setAttribute("pipeline.entityType", "groups");
        }

        @Test
        @DisplayName("Stage spans should carry messaging attributes and the sync page")
        void stageAttributes() {
            EventEnvelope envelope = envelope();

            new OpenTelemetryTracingService(tracer).startSpan("pipeline.fetch", envelope);

            verify(builder).setAttribute("messaging.system", OpenTelemetryTracingService.MESSAGING_SYSTEM);
            verify(builder).setAttribute("messaging.destination.name", envelope.getTopic());
            verify(builder).setAttribute("pipeline.dataSourceId", "ds-1");
            verify(otelSpan).setAttribute(Span.ATTR_SYNC_ID, "sync-1");
            verify(otelSpan).setAttribute(Span.ATTR_BATCH_NUMBER, 2L);
            verify(otelSpan).setAttribute(Span.ATTR_FINAL_BATCH, "false");
        }

        @Test
        @DisplayName("Failing a span should record the cause and describe the error status")
        void failRecordsCause() {
            Span span = new OpenTelemetryTracingService(tracer).startSpan("pipeline.analyze");
            IllegalStateException error = new IllegalStateException("store down");

            span.fail(error);

            verify(otelSpan).recordException(error);
            verify(otelSpan).setStatus(StatusCode.ERROR, "store down");
        }

        @Test
        @DisplayName("Should map status, attributes and exceptions onto the span")
        void spanOperations() {
            Span span = new OpenTelemetryTracingService(tracer).startSpan("pipeline.link");
            RuntimeException error = new RuntimeException("boom");

            span.setAttribute("changed", 3L);
            span.setStatus(Span.SpanStatus.ERROR);
            span.recordException(error);
            span.close();

            verify(otelSpan).setAttribute("changed", 3L);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).recordException(error);
            verify(otelSpan).end();
        }
    }
}
