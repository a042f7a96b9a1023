package com.sync.pipeline.cleanup;

import com.sync.pipeline.GraphRecords;
import com.sync.pipeline.bus.EventEnvelope;
import com.sync.pipeline.bus.InMemoryMessageBus;
import com.sync.pipeline.bus.LinkedPayload;
import com.sync.pipeline.bus.SyncMetadata;
import com.sync.pipeline.bus.SyncPayload;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Relationship;
import com.sync.pipeline.core.model.Stage;
import com.sync.pipeline.history.JobMetrics;
import com.sync.pipeline.link.RelationshipTypes;
import com.sync.pipeline.lock.DistributedLock;
import com.sync.pipeline.lock.LocalDistributedLock;
import com.sync.pipeline.lock.LockAcquisitionException;
import com.sync.pipeline.metrics.MetricsService;
import com.sync.pipeline.store.EntityRepository;
import com.sync.pipeline.store.RelationshipRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CleanupStageTest {

    private static final String TENANT = "tenant-a";
    private static final String DS = "ds-1";
    private static final Instant NOW = Instant.parse("2026-10-16T12:00:00Z");

    private InMemoryMessageBus bus;
    private EntityRepository entities;
    private RelationshipRepository relationships;
    private MetricsService metricsService;

    private Entity seen;
    private Entity gone;
    private Entity group;

    @BeforeEach
    void setUp() {
        bus = InMemoryMessageBus.synchronous();
        entities = new EntityRepository(EntityRepository.inMemoryStore());
        relationships = new RelationshipRepository(RelationshipRepository.inMemoryStore());
        metricsService = mock(MetricsService.class);

        seen = GraphRecords.entity(TENANT, DS, EntityType.IDENTITIES, "u1").syncId("sync-2").build();
        gone = GraphRecords.entity(TENANT, DS, EntityType.IDENTITIES, "u2").syncId("sync-1").build();
        group = GraphRecords.entity(TENANT, DS, EntityType.GROUPS, "g1").syncId("sync-1").build();
        entities.insert(List.of(seen, gone, group));
        relationships.insert(List.of(Relationship.builder()
                .tenantId(TENANT)
                .dataSourceId(DS)
                .sourceEntityType(EntityType.IDENTITIES)
                .sourceEntityId(gone.getId())
                .targetEntityType(EntityType.GROUPS)
                .targetEntityId(group.getId())
                .relationshipType(RelationshipTypes.MEMBER_OF)
                .build()));
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private CleanupStage stage(DistributedLock lock) {
        return new CleanupStage(entities, relationships, lock, bus, metricsService, Duration.ofMinutes(30),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static EventEnvelope linked(String syncId, boolean finalBatch) {
        return linked(syncId, 1, finalBatch);
    }

    private static EventEnvelope linked(String syncId, int batchNumber, boolean finalBatch) {
        SyncMetadata sync = new SyncMetadata(syncId, batchNumber, finalBatch, null, NOW, "job-" + batchNumber);
        EventEnvelope root = EventEnvelope.root("job-1", TENANT, GraphRecords.INTEGRATION, EntityType.IDENTITIES, DS,
                Stage.SYNC, new SyncPayload("job-1", "sync.identities", sync, Map.of()));
        return root.next(Stage.LINKED, new LinkedPayload(0, 0, 0, List.of(), sync, new JobMetrics()));
    }

    private Entity reload(Entity entity) {
        return entities.findByIds(TENANT, List.of(entity.getId())).get(0);
    }

    @Test
    @DisplayName("Final batch should soft-delete entities not seen in the sync and their relationships")
    void testSweep() {
        stage(new LocalDistributedLock()).handle(linked("sync-2", true));

        assertFalse(reload(seen).isDeleted());
        assertTrue(reload(gone).isDeleted());
        assertEquals(NOW, reload(gone).getDeletedAt());
        assertFalse(reload(group).isDeleted(), "other entity types are swept by their own sync");
        assertTrue(relationships.findByDataSource(TENANT, DS, false).isEmpty());
        verify(metricsService).incrementEntities(EntityType.IDENTITIES, MetricsService.EntityChange.DELETED, 1);
    }

    @Test
    @DisplayName("Intermediate batches should not sweep")
    void testNotFinal() {
        stage(new LocalDistributedLock()).handle(linked("sync-2", false));
        assertFalse(reload(gone).isDeleted());
    }

    @Test
    @DisplayName("Sweeping twice should delete nothing more")
    void testIdempotent() {
        CleanupStage stage = stage(new LocalDistributedLock());
        stage.handle(linked("sync-2", true));
        stage.handle(linked("sync-2", true));

        verify(metricsService).incrementEntities(any(), any(), anyLong());
    }

    @Test
    @DisplayName("Should subscribe to linked events")
    void testSubscribed() {
        try (CleanupStage stage = stage(new LocalDistributedLock()).subscribe()) {
            bus.publish(linked("sync-2", true));
            assertTrue(reload(gone).isDeleted());
        }
    }

    @Test
    @DisplayName("Lock failures should leave entities for the next sync")
    void testLockFailure() {
        DistributedLock lock = mock(DistributedLock.class);
        when(lock.withLock(anyString(), any())).thenThrow(new LockAcquisitionException("busy"));

        assertDoesNotThrow(() -> stage(lock).handle(linked("sync-2", true)));
        assertFalse(reload(gone).isDeleted());
        verify(metricsService, never()).incrementEntities(any(), any(), anyLong());
    }

    @Nested
    @DisplayName("Out of order pages")
    class PageOrderTests {

        @Test
        @DisplayName("A final page linked before an earlier page should wait for it before sweeping")
        void testFinalPageFirst() {
            CleanupStage stage = stage(new LocalDistributedLock());

            stage.handle(linked("sync-2", 2, true));

            assertFalse(reload(seen).isDeleted());
            assertFalse(reload(gone).isDeleted());
            assertEquals(1, stage.getPendingSyncs());
            verify(metricsService, never()).incrementEntities(any(), any(), anyLong());

            stage.handle(linked("sync-2", 1, false));

            assertFalse(reload(seen).isDeleted());
            assertTrue(reload(gone).isDeleted());
            assertEquals(0, stage.getPendingSyncs());
        }

        @Test
        @DisplayName("Pages arriving in order should sweep once the final one is linked")
        void testInOrder() {
            CleanupStage stage = stage(new LocalDistributedLock());

            stage.handle(linked("sync-2", 1, false));
            stage.handle(linked("sync-2", 2, false));
            assertFalse(reload(gone).isDeleted());

            stage.handle(linked("sync-2", 3, true));
            assertTrue(reload(gone).isDeleted());
        }

        @Test
        @DisplayName("A missing middle page should block the sweep")
        void testGap() {
            CleanupStage stage = stage(new LocalDistributedLock());

            stage.handle(linked("sync-2", 1, false));
            stage.handle(linked("sync-2", 3, true));

            assertFalse(reload(gone).isDeleted());
            assertEquals(1, stage.getPendingSyncs());
        }

        @Test
        @DisplayName("Batches of different syncs should be tracked apart")
        void testSyncsTrackedApart() {
            CleanupStage stage = stage(new LocalDistributedLock());

            stage.handle(linked("sync-1", 1, false));
            stage.handle(linked("sync-2", 2, true));

            assertFalse(reload(gone).isDeleted());
            assertEquals(2, stage.getPendingSyncs());
        }
    }
}
