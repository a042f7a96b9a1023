package com.sync.pipeline.analysis.nodes;

import com.sync.pipeline.GraphRecords;
import com.sync.pipeline.alert.Alert;
import com.sync.pipeline.alert.AlertService;
import com.sync.pipeline.alert.AlertSeverity;
import com.sync.pipeline.alert.AlertStatus;
import com.sync.pipeline.analysis.context.ContextLoader;
import com.sync.pipeline.analysis.workflow.AnalysisScope;
import com.sync.pipeline.analysis.workflow.BatchFlusher;
import com.sync.pipeline.analysis.workflow.WorkflowEngine;
import com.sync.pipeline.analysis.workflow.WorkflowResult;
import com.sync.pipeline.audit.AuditService;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityState;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Relationship;
import com.sync.pipeline.link.RelationshipTypes;
import com.sync.pipeline.lock.LocalDistributedLock;
import com.sync.pipeline.metrics.NoOpMetricsService;
import com.sync.pipeline.store.EntityRepository;
import com.sync.pipeline.store.RelationshipRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class Microsoft365SecurityWorkerTest {

    private static final String TENANT = "tenant-a";
    private static final String DS = "ds-1";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-16T12:00:00Z"), ZoneOffset.UTC);

    private EntityRepository entities;
    private RelationshipRepository relationships;
    private AlertService alertService;
    private WorkflowEngine engine;
    private Microsoft365SecurityWorker worker;

    private Entity admin;
    private Entity member;
    private Entity disabled;
    private Entity group;

    @BeforeEach
    void setUp() {
        entities = new EntityRepository(EntityRepository.inMemoryStore());
        relationships = new RelationshipRepository(RelationshipRepository.inMemoryStore());
        alertService = new AlertService(AlertService.inMemoryStore(), new AuditService(), CLOCK);
        ContextLoader loader = new ContextLoader(entities, relationships, Runnable::run, 1000, 5000,
                new NoOpMetricsService());
        engine = new WorkflowEngine(loader,
                new BatchFlusher(entities, alertService, new LocalDistributedLock(), CLOCK), new NoOpMetricsService());
        worker = new Microsoft365SecurityWorker(alertService);

        admin = GraphRecords.identity(TENANT, DS, "u1", true);
        member = GraphRecords.identity(TENANT, DS, "u2", true);
        disabled = GraphRecords.identity(TENANT, DS, "u3", false);
        group = GraphRecords.named(TENANT, DS, EntityType.GROUPS, "g1", "Finance");
        Entity role = GraphRecords.named(TENANT, DS, EntityType.ROLES, "r1", "Global Administrator");
        entities.insert(List.of(admin, member, disabled, group, role,
                GraphRecords.mfaPolicy(TENANT, DS, "p1", List.of(), List.of("g1"))));
        relationships.insert(List.of(
                link(admin, EntityType.ROLES, role, RelationshipTypes.ASSIGNED_ROLE),
                link(member, EntityType.GROUPS, group, RelationshipTypes.MEMBER_OF)));
    }

    private static Relationship link(Entity source, EntityType targetType, Entity target, String type) {
        return Relationship.builder()
                .tenantId(TENANT)
                .dataSourceId(DS)
                .sourceEntityType(EntityType.IDENTITIES)
                .sourceEntityId(source.getId())
                .targetEntityType(targetType)
                .targetEntityId(target.getId())
                .relationshipType(type)
                .build();
    }

    private static AnalysisScope scope(String integration, Set<EntityType> types) {
        return new AnalysisScope(TENANT, integration, DS, "sync-1", types, Set.of("changed"), true);
    }

    private WorkflowResult analyze() {
        List<WorkflowResult> results = engine.runAll(
                scope(GraphRecords.INTEGRATION, Set.of(EntityType.IDENTITIES)), List.of(worker));
        assertEquals(1, results.size());
        return results.get(0);
    }

    private Entity reload(Entity entity) {
        return entities.findByIds(TENANT, List.of(entity.getId())).get(0);
    }

    private Alert mfaAlert(Entity identity) {
        return alertService.findByEntity(TENANT, identity.getId()).stream()
                .filter(a -> a.getAlertType().equals(MfaEnforcementNode.ALERT_TYPE))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("Applicability")
    class ApplicabilityTests {

        @Test
        @DisplayName("Should apply to Microsoft 365 identity changes")
        void testApplies() {
            assertEquals(3, worker.nodes(scope(GraphRecords.INTEGRATION, Set.of(EntityType.POLICIES))).size());
            assertTrue(worker.requiresFullContext());
        }

        @Test
        @DisplayName("Should not apply to other integrations or unrelated types")
        void testDoesNotApply() {
            assertTrue(worker.nodes(scope("halopsa", Set.of(EntityType.IDENTITIES))).isEmpty());
            assertTrue(worker.nodes(scope(GraphRecords.INTEGRATION, Set.of(EntityType.LICENSES))).isEmpty());
        }

        @Test
        @DisplayName("Node order should satisfy every requirement")
        void testValidOrder() {
            assertDoesNotThrow(() -> WorkflowEngine.validate(worker.name(),
                    worker.nodes(scope(GraphRecords.INTEGRATION, Set.of(EntityType.IDENTITIES)))));
        }
    }

    @Nested
    @DisplayName("Posture")
    class PostureTests {

        @Test
        @DisplayName("Administrator without MFA should be tagged and alerted as critical")
        void testAdminWithoutMfa() {
            WorkflowResult result = analyze();

            assertEquals(1, result.alertsCreated());
            Entity stored = reload(admin);
            assertTrue(stored.hasTag("Admin"));
            assertFalse(stored.hasTag("MFA"));
            assertEquals(EntityState.CRITICAL, stored.getState());
            Alert alert = mfaAlert(admin);
            assertEquals(AlertSeverity.CRITICAL, alert.getSeverity());
            assertEquals(AlertStatus.ACTIVE, alert.getStatus());
        }

        @Test
        @DisplayName("Group covered by an MFA policy should be tagged without an alert")
        void testCoveredMember() {
            analyze();

            Entity stored = reload(member);
            assertTrue(stored.hasTag("MFA"));
            assertFalse(stored.hasTag("Admin"));
            assertEquals(EntityState.NORMAL, stored.getState());
            assertTrue(alertService.findByEntity(TENANT, member.getId()).isEmpty());
        }

        @Test
        @DisplayName("Disabled identities should not be alerted")
        void testDisabled() {
            analyze();
            assertTrue(alertService.findByEntity(TENANT, disabled.getId()).isEmpty());
        }

        @Test
        @DisplayName("Enforcing MFA should resolve the alert and restore the state")
        void testResolve() {
            analyze();
            entities.insert(List.of(GraphRecords.mfaPolicy(TENANT, DS, "p2", List.of("u1"), List.of())));

            WorkflowResult second = analyze();

            assertEquals(1, second.alertsResolved());
            assertEquals(AlertStatus.RESOLVED, mfaAlert(admin).getStatus());
            Entity stored = reload(admin);
            assertTrue(stored.hasTag("MFA"));
            assertEquals(EntityState.NORMAL, stored.getState());
        }

        @Test
        @DisplayName("Security defaults should cover every identity")
        void testSecurityDefaults() {
            entities.insert(List.of(GraphRecords.entity(TENANT, DS, EntityType.POLICIES, "security-defaults")
                    .normalizedData(Map.of("policyType", "security_defaults", "status", "enabled"))
                    .build()));

            WorkflowResult result = analyze();

            assertEquals(0, result.alertsCreated());
            assertTrue(reload(admin).hasTag("MFA"));
        }

        @Test
        @DisplayName("A suppressed alert should stay suppressed and not drive the state")
        void testSuppressed() {
            analyze();
            alertService.suppress(TENANT, mfaAlert(admin).getId(), "operator-1", "accepted risk", null);

            WorkflowResult second = analyze();

            assertEquals(1, second.alertsRefreshed());
            assertEquals(AlertStatus.SUPPRESSED, mfaAlert(admin).getStatus());
            assertEquals(EntityState.NORMAL, reload(admin).getState());
        }

        @Test
        @DisplayName("Re-running without changes should be a no-op")
        void testIdempotent() {
            analyze();
            WorkflowResult second = analyze();

            assertEquals(0, second.entitiesUpdated());
            assertEquals(0, second.alertsCreated());
            assertEquals(0, second.alertsResolved());
        }
    }
}
