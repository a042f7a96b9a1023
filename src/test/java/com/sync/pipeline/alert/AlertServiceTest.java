package com.sync.pipeline.alert;

import com.sync.pipeline.audit.AuditAction;
import com.sync.pipeline.audit.AuditEntry;
import com.sync.pipeline.audit.AuditService;
import com.sync.pipeline.audit.InMemoryAuditRepository;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.lock.LocalDistributedLock;
import com.sync.pipeline.store.InMemoryDocumentStore;
import com.sync.pipeline.tenant.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

class AlertServiceTest {

    private static final String TENANT = "tenant-a";
    private static final String DS = "ds-1";
    private static final String TYPE = "mfa_not_enforced";
    private static final Instant NOW = Instant.parse("2026-10-16T12:00:00Z");

    private InMemoryDocumentStore<Alert> store;
    private AuditService auditService;
    private AlertService service;

    @BeforeEach
    void setUp() {
        store = AlertService.inMemoryStore();
        auditService = new AuditService(new InMemoryAuditRepository(), Clock.fixed(NOW, ZoneOffset.UTC));
        service = new AlertService(store, auditService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AlertCandidate candidate(String entityId, AlertSeverity severity) {
        return new AlertCandidate(TYPE, entityId, EntityType.IDENTITIES, severity, "MFA missing", Map.of());
    }

    private AlertService.ReconcileResult reconcile(AlertCandidate... raised) {
        return service.reconcile(TENANT, DS, Set.of(TYPE), List.of(raised), Set.of());
    }

    private Alert only() {
        List<Alert> all = service.findByEntity(TENANT, "e1");
        assertEquals(1, all.size());
        return all.get(0);
    }

    @Nested
    @DisplayName("Reconciliation")
    class ReconcileTests {

        @Test
        @DisplayName("Should create an alert for a new candidate")
        void testCreate() {
            AlertService.ReconcileResult result = reconcile(candidate("e1", AlertSeverity.HIGH));

            assertEquals(new AlertService.ReconcileResult(1, 0, 0), result);
            Alert alert = only();
            assertEquals(AlertStatus.ACTIVE, alert.getStatus());
            assertEquals(DS, alert.getDataSourceId());
            assertEquals(NOW, alert.getCreatedAt());
            assertEquals(TYPE + ":e1", alert.getFingerprint());
        }

        @Test
        @DisplayName("Should refresh an alert raised again without duplicating it")
        void testRefresh() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            AlertService.ReconcileResult result = reconcile(candidate("e1", AlertSeverity.CRITICAL));

            assertEquals(new AlertService.ReconcileResult(0, 1, 0), result);
            assertEquals(AlertSeverity.CRITICAL, only().getSeverity());
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("Should resolve alerts of an evaluated type that were not raised again")
        void testResolveMissing() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            AlertService.ReconcileResult result = reconcile();

            assertEquals(1, result.resolved());
            Alert alert = only();
            assertTrue(alert.isResolved());
            assertEquals(NOW, alert.getResolvedAt());
        }

        @Test
        @DisplayName("Should leave alerts of types that were not evaluated")
        void testOtherTypesUntouched() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            AlertService.ReconcileResult result = service.reconcile(TENANT, DS, Set.of("other_rule"), List.of(), Set.of());

            assertEquals(0, result.resolved());
            assertFalse(only().isResolved());
        }

        @Test
        @DisplayName("Should resolve explicitly cleared fingerprints")
        void testExplicitResolve() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            AlertService.ReconcileResult result = service.reconcile(TENANT, DS, Set.of(), List.of(),
                    Set.of(AlertCandidate.fingerprint(TYPE, "e1")));

            assertEquals(1, result.resolved());
        }

        @Test
        @DisplayName("Should reopen a resolved alert and count it as created")
        void testReopen() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            reconcile();
            String id = only().getId();

            AlertService.ReconcileResult result = reconcile(candidate("e1", AlertSeverity.HIGH));

            assertEquals(1, result.created());
            Alert alert = only();
            assertEquals(id, alert.getId());
            assertEquals(AlertStatus.ACTIVE, alert.getStatus());
            assertNull(alert.getResolvedAt());
        }

        @Test
        @DisplayName("Should keep a suppressed alert suppressed while it is raised")
        void testSuppressedPreserved() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            service.suppress(TENANT, only().getId(), "operator-1", "accepted risk", null);

            AlertService.ReconcileResult result = reconcile(candidate("e1", AlertSeverity.HIGH));

            assertEquals(1, result.refreshed());
            assertEquals(AlertStatus.SUPPRESSED, only().getStatus());
        }

        @Test
        @DisplayName("Should scope alerts by data source")
        void testDataSourceScope() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            service.reconcile(TENANT, "ds-2", Set.of(TYPE), List.of(), Set.of());

            assertEquals(1, service.findUnresolved(TENANT, DS).size());
            assertTrue(service.findUnresolved(TENANT, "ds-2").isEmpty());
        }
    }

    @Nested
    @DisplayName("Suppression")
    class SuppressionTests {

        @Test
        @DisplayName("Should suppress and audit the change")
        void testSuppress() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            String id = only().getId();

            Alert suppressed = service.suppress(TENANT, id, "operator-1", "accepted risk",
                    NOW.plus(Duration.ofDays(7)));

            assertEquals(AlertStatus.SUPPRESSED, suppressed.getStatus());
            assertEquals("operator-1", suppressed.getSuppressedBy());
            assertEquals("accepted risk", suppressed.getSuppressionReason());
            List<AuditEntry> entries = auditService.getEntriesFor(TENANT, id);
            assertEquals(1, entries.size());
            assertEquals(AuditAction.ALERT_SUPPRESSED, entries.get(0).action());
            assertEquals("ACTIVE", entries.get(0).before().get("status"));
            assertEquals("SUPPRESSED", entries.get(0).after().get("status"));
            assertEquals("accepted risk", entries.get(0).after().get("suppressionReason"));
            assertFalse(entries.get(0).before().containsKey("suppressionReason"));
        }

        @Test
        @DisplayName("Should unsuppress and audit the change")
        void testUnsuppress() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            String id = only().getId();
            service.suppress(TENANT, id, "operator-1", "accepted risk", null);

            Alert active = service.unsuppress(TENANT, id, "operator-2");

            assertEquals(AlertStatus.ACTIVE, active.getStatus());
            assertNull(active.getSuppressedBy());
            assertNull(active.getSuppressionReason());
            AuditEntry entry = auditService.getEntriesByAction(TENANT, AuditAction.ALERT_UNSUPPRESSED).get(0);
            assertEquals("accepted risk", entry.before().get("suppressionReason"));
            assertFalse(entry.after().containsKey("suppressionReason"));
            assertEquals(1, auditService.getEntriesByAction(TENANT, AuditAction.ALERT_UNSUPPRESSED).size());
        }

        @Test
        @DisplayName("Should reject invalid transitions")
        void testInvalidTransitions() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            String id = only().getId();

            assertThrows(IllegalStateException.class, () -> service.unsuppress(TENANT, id, "operator-1"));
            service.suppress(TENANT, id, "operator-1", "accepted risk", null);
            assertThrows(IllegalStateException.class,
                    () -> service.suppress(TENANT, id, "operator-1", "accepted risk", null));
            assertThrows(IllegalArgumentException.class,
                    () -> service.suppress(TENANT, "missing", "operator-1", "accepted risk", null));
        }

        @Test
        @DisplayName("Should refuse access from another tenant")
        void testTenantIsolation() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            String id = only().getId();

            try (TenantContext.TenantScope scope = TenantContext.scoped("tenant-b")) {
                assertThrows(IllegalStateException.class,
                        () -> service.suppress(TENANT, id, "operator-1", "accepted risk", null));
            }
            assertThrows(IllegalArgumentException.class,
                    () -> service.suppress("tenant-b", id, "operator-1", "accepted risk", null));
        }

        @Test
        @DisplayName("Should reactivate suppressions that have expired")
        void testReactivateExpired() {
            reconcile(candidate("e1", AlertSeverity.HIGH), candidate("e2", AlertSeverity.HIGH));
            List<Alert> alerts = service.findUnresolved(TENANT, DS);
            Alert expiring = alerts.get(0);
            Alert indefinite = alerts.get(1);
            service.suppress(TENANT, expiring.getId(), "operator-1", "maintenance window",
                    NOW.plus(Duration.ofHours(1)));
            service.suppress(TENANT, indefinite.getId(), "operator-1", "accepted risk", null);

            assertEquals(0, service.reactivateExpired(TENANT, NOW));
            assertEquals(1, service.reactivateExpired(TENANT, NOW.plus(Duration.ofHours(1))));

            assertEquals(AlertStatus.ACTIVE, service.get(TENANT, expiring.getId()).orElseThrow().getStatus());
            assertEquals(AlertStatus.SUPPRESSED, service.get(TENANT, indefinite.getId()).orElseThrow().getStatus());
            List<AuditEntry> expired = auditService.getEntriesByAction(TENANT, AuditAction.ALERT_SUPPRESSION_EXPIRED);
            assertEquals(1, expired.size());
            assertEquals(AuditService.SYSTEM_ACTOR, expired.get(0).actorId());
        }
    }

    @Nested
    @DisplayName("Concurrent transitions")
    class ConcurrencyTests {

        @Test
        @DisplayName("Two operators suppressing the same alert should yield one suppression and one audit record")
        void testConcurrentSuppress() throws Exception {
            // each read waits briefly for a second reader, so unguarded callers would both see ACTIVE
            CountDownLatch readers = new CountDownLatch(2);
            InMemoryDocumentStore<Alert> slowStore = spy(AlertService.inMemoryStore());
            doAnswer(invocation -> {
                readers.countDown();
                readers.await(200, TimeUnit.MILLISECONDS);
                return invocation.callRealMethod();
            }).when(slowStore).get(anyString(), anyString());
            AlertService guarded = new AlertService(slowStore, auditService, new LocalDistributedLock(),
                    Clock.fixed(NOW, ZoneOffset.UTC));
            guarded.reconcile(TENANT, DS, Set.of(TYPE), List.of(candidate("e1", AlertSeverity.HIGH)), Set.of());
            String id = guarded.findByEntity(TENANT, "e1").get(0).getId();

            CountDownLatch start = new CountDownLatch(1);
            ExecutorService operators = Executors.newFixedThreadPool(2);
            List<Future<Alert>> attempts = new ArrayList<>();
            try {
                for (String operator : List.of("operator-1", "operator-2")) {
                    attempts.add(operators.submit(() -> {
                        start.await();
                        return guarded.suppress(TENANT, id, operator, "duplicate ticket", null);
                    }));
                }
                start.countDown();

                int succeeded = 0;
                int rejected = 0;
                for (Future<Alert> attempt : attempts) {
                    try {
                        attempt.get(10, TimeUnit.SECONDS);
                        succeeded++;
                    } catch (ExecutionException e) {
                        assertInstanceOf(IllegalStateException.class, e.getCause());
                        rejected++;
                    }
                }
                assertEquals(1, succeeded);
                assertEquals(1, rejected);
            } finally {
                operators.shutdownNow();
            }

            assertEquals(1, auditService.getEntriesByAction(TENANT, AuditAction.ALERT_SUPPRESSED).size());
            assertEquals(AlertStatus.SUPPRESSED, guarded.get(TENANT, id).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("The expiry sweep should skip an alert an operator already unsuppressed")
        void testExpiryAfterUnsuppress() {
            reconcile(candidate("e1", AlertSeverity.HIGH));
            String id = only().getId();
            service.suppress(TENANT, id, "operator-1", "accepted risk", NOW.plus(Duration.ofHours(1)));
            service.unsuppress(TENANT, id, "operator-2");

            assertEquals(0, service.reactivateExpired(TENANT, NOW.plus(Duration.ofHours(2))));
            assertTrue(auditService.getEntriesByAction(TENANT, AuditAction.ALERT_SUPPRESSION_EXPIRED).isEmpty());
        }

        @Test
        @DisplayName("A suppression made while reconciliation runs should survive the refresh")
        void testSuppressDuringReconcile() {
            InMemoryDocumentStore<Alert> racingStore = spy(AlertService.inMemoryStore());
            AlertService racing = new AlertService(racingStore, auditService, new LocalDistributedLock(),
                    Clock.fixed(NOW, ZoneOffset.UTC));
            racing.reconcile(TENANT, DS, Set.of(TYPE), List.of(candidate("e1", AlertSeverity.HIGH)), Set.of());
            String id = racing.findByEntity(TENANT, "e1").get(0).getId();

            // an operator suppresses right after reconciliation has read the stored alerts
            AtomicBoolean armed = new AtomicBoolean(true);
            doAnswer(invocation -> {
                Object found = invocation.callRealMethod();
                if (armed.getAndSet(false)) {
                    racing.suppress(TENANT, id, "operator-1", "accepted risk", null);
                }
                return found;
            }).when(racingStore).find(anyString(), any());

            AlertService.ReconcileResult result = racing.reconcile(TENANT, DS, Set.of(TYPE),
                    List.of(candidate("e1", AlertSeverity.CRITICAL)), Set.of());

            assertEquals(1, result.refreshed());
            Alert alert = racing.get(TENANT, id).orElseThrow();
            assertEquals(AlertStatus.SUPPRESSED, alert.getStatus());
            assertEquals("accepted risk", alert.getSuppressionReason());
            assertEquals(AlertSeverity.CRITICAL, alert.getSeverity());
        }

        @Test
        @DisplayName("Alert lock keys should be scoped by tenant")
        void testLockKey() {
            assertEquals("alert:tenant-a:a1", AlertService.alertLockKey(TENANT, "a1"));
        }
    }
}
