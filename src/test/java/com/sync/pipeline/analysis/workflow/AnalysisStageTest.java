package com.sync.pipeline.analysis.workflow;

import com.sync.pipeline.GraphRecords;
import com.sync.pipeline.bus.CompletedPayload;
import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.FailedPayload;
import com.sync.pipeline.bus.InMemoryMessageBus;
import com.sync.pipeline.bus.LinkedPayload;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.SyncPayload;
import com.sync.pipeline.bus.Topic;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.history.JobMetrics;
import com.sync.pipeline.metrics.NoOpMetricsService;
import com.sync.pipeline.store.StorageException;
import com.sync.pipeline.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalysisStageTest {

    private static final String TENANT = "tenant-a";
    private static final String DS = "ds-1";

    private InMemoryMessageBus bus;
    private WorkflowEngine engine;
    private final List<CompletedPayload> completed = new CopyOnWriteArrayList<>();
    private final List<FailedPayload> failed = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        bus = InMemoryMessageBus.synchronous();
        bus.subscribe(Topic.allOf(Stage.COMPLETED), e -> completed.add(e.payloadAs(CompletedPayload.class)));
        bus.subscribe(Topic.allOf(Stage.FAILED), e -> failed.add(e.payloadAs(FailedPayload.class)));
        engine = mock(WorkflowEngine.class);
        when(engine.runAll(any(), anyList())).thenReturn(List.of());
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private AnalysisStage stage(AnalysisWorker... workers) {
        return new AnalysisStage(List.of(workers), engine, bus, Duration.ofMinutes(30), new NoOpMetricsService(),
                new NoOpTracingService(), Clock.systemUTC());
    }

    private static AnalysisWorker worker(String name, boolean fullContext) {
        return new AnalysisWorker() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<Node> nodes(AnalysisScope scope) {
                return List.of();
            }

            @Override
            public boolean requiresFullContext() {
                return fullContext;
            }
        };
    }

    private static EventEnvelope linked(EntityType type, List<String> changedIds, int batch, boolean finalBatch) {
        SyncMetadata sync = new SyncMetadata("sync-1", batch, finalBatch, null, Instant.now(), "job-" + batch);
        EventEnvelope root = EventEnvelope.root("job-" + batch, TENANT, GraphRecords.INTEGRATION, type, DS,
                Stage.SYNC, new SyncPayload("job-" + batch, "sync." + type.getWireName(), sync, Map.of()));
        return root.next(Stage.LINKED, new LinkedPayload(0, 0, 0, changedIds, sync, new JobMetrics()));
    }

    @Nested
    @DisplayName("Per-batch workers")
    class PerBatchTests {

        @Test
        @DisplayName("Should run on every batch with its changed entities")
        void testRunsPerBatch() {
            AnalysisStage stage = stage(worker("batch", false));

            stage.handle(linked(EntityType.IDENTITIES, List.of("e1", "e2"), 1, false));

            ArgumentCaptor<AnalysisScope> scope = ArgumentCaptor.forClass(AnalysisScope.class);
            verify(engine).runAll(scope.capture(), anyList());
            assertEquals(Set.of("e1", "e2"), scope.getValue().changedEntityIds());
            assertEquals(Set.of(EntityType.IDENTITIES), scope.getValue().changedTypes());
            assertFalse(scope.getValue().finalBatch());
            assertEquals(1, completed.size());
        }

        @Test
        @DisplayName("Should skip a batch without changes but still complete it")
        void testNoChanges() {
            stage(worker("batch", false)).handle(linked(EntityType.IDENTITIES, List.of(), 1, true));

            verify(engine, never()).runAll(any(), anyList());
            assertEquals(1, completed.size());
            assertEquals(0, completed.get(0).workflowsRun());
        }
    }

    @Nested
    @DisplayName("Full-context workers")
    class FullContextTests {

        @Test
        @DisplayName("Should defer until the final batch and run once with aggregated changes")
        void testAggregation() {
            AnalysisStage stage = stage(worker("posture", true));

            stage.handle(linked(EntityType.IDENTITIES, List.of("e1"), 1, false));
            stage.handle(linked(EntityType.GROUPS, List.of("g1"), 1, false));
            verify(engine, never()).runAll(any(), anyList());
            assertEquals(1, stage.getPendingAggregations());

            stage.handle(linked(EntityType.IDENTITIES, List.of("e2"), 2, true));

            ArgumentCaptor<AnalysisScope> scope = ArgumentCaptor.forClass(AnalysisScope.class);
            verify(engine, times(1)).runAll(scope.capture(), anyList());
            assertEquals(Set.of("e1", "g1", "e2"), scope.getValue().changedEntityIds());
            assertEquals(Set.of(EntityType.IDENTITIES, EntityType.GROUPS), scope.getValue().changedTypes());
            assertTrue(scope.getValue().finalBatch());
            assertEquals(0, stage.getPendingAggregations());
            assertEquals(3, completed.size());
        }

        @Test
        @DisplayName("Should not run when the whole sync changed nothing")
        void testNothingChanged() {
            AnalysisStage stage = stage(worker("posture", true));

            stage.handle(linked(EntityType.IDENTITIES, List.of(), 1, false));
            stage.handle(linked(EntityType.IDENTITIES, List.of(), 2, true));

            verify(engine, never()).runAll(any(), anyList());
        }

        @Test
        @DisplayName("Should sum alert counts into the completed event")
        void testCounts() {
            when(engine.runAll(any(), anyList())).thenReturn(List.of(
                    new WorkflowResult("posture", 3, 2, 4, 1, 2, 5)));

            stage(worker("posture", true)).handle(linked(EntityType.IDENTITIES, List.of("e1"), 1, true));

            CompletedPayload payload = completed.get(0);
            assertEquals(1, payload.workflowsRun());
            assertEquals(4, payload.alertsRaised());
            assertEquals(2, payload.alertsResolved());
            assertTrue(payload.metrics().getStageTimesMs().containsKey(JobMetrics.Phase.ANALYZE));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Node failures should publish a non-retryable failure")
        void testNodeFailure() {
            when(engine.runAll(any(), anyList())).thenThrow(new NodeExecutionException("tag-admin", "boom"));

            stage(worker("batch", false)).handle(linked(EntityType.IDENTITIES, List.of("e1"), 1, true));

            assertTrue(completed.isEmpty());
            FailedPayload payload = failed.get(0);
            assertEquals(Stage.COMPLETED, payload.failedStage());
            assertFalse(payload.error().retryable());
            assertEquals("boom", payload.error().message());
        }

        @Test
        @DisplayName("Storage failures should publish a retryable failure")
        void testStorageFailure() {
            when(engine.runAll(any(), anyList())).thenThrow(new StorageException("down"));

            stage(worker("batch", false)).handle(linked(EntityType.IDENTITIES, List.of("e1"), 1, true));

            assertTrue(failed.get(0).error().retryable());
            assertEquals("sync-1", failed.get(0).syncMetadata().syncId());
        }

        @Test
        @DisplayName("Unexpected worker errors should publish a failure instead of escaping the handler")
        void testUnexpectedFailure() {
            when(engine.runAll(any(), anyList())).thenThrow(new ClassCastException("bad node output"));

            assertDoesNotThrow(() -> stage(worker("batch", false))
                    .handle(linked(EntityType.IDENTITIES, List.of("e1"), 1, true)));

            assertTrue(completed.isEmpty());
            assertEquals(1, failed.size());
            assertEquals(Stage.COMPLETED, failed.get(0).failedStage());
            assertEquals("bad node output", failed.get(0).error().message());
        }
    }

    @Test
    @DisplayName("Should complete without analysis when no worker is registered")
    void testNoWorkers() {
        stage().handle(linked(EntityType.IDENTITIES, List.of("e1"), 1, true));
        verify(engine, never()).runAll(any(), anyList());
        assertEquals(1, completed.size());
    }
}
