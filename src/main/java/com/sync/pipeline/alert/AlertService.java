package com.sync.pipeline.alert;

import com.sync.pipeline.audit.AuditAction;
import com.sync.pipeline.audit.AuditService;
import com.sync.pipeline.lock.DistributedLock;
import com.sync.pipeline.lock.LocalDistributedLock;
import com.sync.pipeline.store.DocumentStore;
import com.sync.pipeline.store.InMemoryDocumentStore;
import com.sync.pipeline.tenant.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Alert lifecycle: reconciliation of analysis results and operator suppression.
 *
 * <p>Reconciliation runs once per workflow with every candidate raised by it. Candidates
 * without a stored alert create one, candidates matching an unresolved alert refresh it,
 * and unresolved alerts of the evaluated rule types that were not raised again are
 * resolved. Suppression is an operator action and is audited; the status of a suppressed
 * alert is preserved while it keeps being raised.</p>
 *
 * <p>Every write to an existing alert runs under the lock {@code alert:<tenant>:<alertId>}
 * and applies to the alert as re-read once the lock is held. Concurrent operators, the
 * expiry sweep and reconciliation therefore see each other's writes, and each operator
 * transition is audited once.</p>
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final DocumentStore<Alert> store;
    private final AuditService auditService;
    private final DistributedLock lock;
    private final Clock clock;

    public AlertService(DocumentStore<Alert> store, AuditService auditService, Clock clock) {
        this(store, auditService, new LocalDistributedLock(), clock);
    }

    public AlertService(DocumentStore<Alert> store, AuditService auditService, DistributedLock lock, Clock clock) {
        this.store = store;
        this.auditService = auditService;
        this.lock = lock;
        this.clock = clock;
    }

    /**
     * Creates an in-memory alert table with the fingerprint uniqueness constraint.
     */
    public static InMemoryDocumentStore<Alert> inMemoryStore() {
        return new InMemoryDocumentStore<>("alerts", Alert::key);
    }

    /**
     * Applies the outcome of one analysis run to the stored alerts of a data source.
     *
     * @param evaluatedAlertTypes rule types the run evaluated; their unresolved alerts not raised again are resolved
     * @param raised              candidates raised by the run
     * @param resolvedFingerprints fingerprints a rule explicitly cleared
     */
    public ReconcileResult reconcile(String tenantId, String dataSourceId, Set<String> evaluatedAlertTypes,
                                     Collection<AlertCandidate> raised, Set<String> resolvedFingerprints) {
        Instant now = clock.instant();
        Map<String, Alert> existing = new HashMap<>();
        for (Alert alert : store.find(tenantId, a -> Objects.equals(dataSourceId, a.getDataSourceId()))) {
            existing.put(alert.getFingerprint(), alert);
        }

        Map<String, AlertCandidate> byFingerprint = new LinkedHashMap<>();
        raised.forEach(candidate -> byFingerprint.put(candidate.fingerprint(), candidate));

        List<Alert> toInsert = new ArrayList<>();
        Map<String, UnaryOperator<Alert>> changes = new LinkedHashMap<>();
        int created = 0;
        int refreshed = 0;
        int resolved = 0;

        for (AlertCandidate candidate : byFingerprint.values()) {
            Alert stored = existing.get(candidate.fingerprint());
            if (stored == null) {
                toInsert.add(Alert.builder()
                        .tenantId(tenantId)
                        .dataSourceId(dataSourceId)
                        .alertType(candidate.alertType())
                        .entityId(candidate.entityId())
                        .entityType(candidate.entityType())
                        .severity(candidate.severity())
                        .message(candidate.message())
                        .details(candidate.details())
                        .status(AlertStatus.ACTIVE)
                        .createdAt(now)
                        .lastSeenAt(now)
                        .build());
                created++;
            } else if (stored.isResolved()) {
                changes.put(stored.getId(), current -> current.toBuilder()
                        .severity(candidate.severity())
                        .message(candidate.message())
                        .details(candidate.details())
                        .status(AlertStatus.ACTIVE)
                        .suppressedBy(null)
                        .suppressionReason(null)
                        .suppressedAt(null)
                        .suppressedUntil(null)
                        .lastSeenAt(now)
                        .resolvedAt(null)
                        .build());
                created++;
            } else {
                changes.put(stored.getId(), current -> current.toBuilder()
                        .severity(candidate.severity())
                        .message(candidate.message())
                        .details(candidate.details())
                        .lastSeenAt(now)
                        .build());
                refreshed++;
            }
        }

        for (Alert stored : existing.values()) {
            if (stored.isResolved() || byFingerprint.containsKey(stored.getFingerprint())) {
                continue;
            }
            if (evaluatedAlertTypes.contains(stored.getAlertType())
                    || resolvedFingerprints.contains(stored.getFingerprint())) {
                changes.put(stored.getId(), current -> current.toBuilder()
                        .status(AlertStatus.RESOLVED)
                        .resolvedAt(now)
                        .build());
                resolved++;
            }
        }

        if (!toInsert.isEmpty()) {
            store.insert(toInsert);
        }
        // applied to a fresh read under the alert's lock, so an operator transition made since the read above is kept
        changes.forEach((alertId, change) -> lock.withLock(alertLockKey(tenantId, alertId), () -> {
            store.get(tenantId, alertId).ifPresent(current -> store.update(List.of(change.apply(current))));
            return null;
        }));
        log.info("alerts.reconciled dataSourceId={} created={} refreshed={} resolved={}",
                dataSourceId, created, refreshed, resolved);
        return new ReconcileResult(created, refreshed, resolved);
    }

    /**
     * Suppresses an active alert.
     *
     * @param reason operator's note, may be null
     * @param until  when the suppression expires, null for indefinitely
     * @throws IllegalArgumentException  if the alert does not exist for the tenant
     * @throws IllegalStateException     if the alert is not active
     * @throws com.sync.pipeline.lock.LockAcquisitionException if another transition of the alert holds its lock
     */
    public Alert suppress(String tenantId, String alertId, String actorId, String reason, Instant until) {
        TenantContext.checkAccess(tenantId);
        return lock.withLock(alertLockKey(tenantId, alertId), () -> {
            Alert alert = require(tenantId, alertId);
            if (alert.getStatus() != AlertStatus.ACTIVE) {
                throw new IllegalStateException("Alert " + alertId + " is " + alert.getStatus() + ", not ACTIVE");
            }
            Alert suppressed = alert.toBuilder()
                    .status(AlertStatus.SUPPRESSED)
                    .suppressedBy(actorId)
                    .suppressionReason(reason)
                    .suppressedAt(clock.instant())
                    .suppressedUntil(until)
                    .build();
            store.update(List.of(suppressed));
            auditService.record(tenantId, AuditAction.ALERT_SUPPRESSED, alertId, actorId,
                    alert.auditState(), suppressed.auditState());
            log.info("alert.suppressed alertId={} actor={} until={}", alertId, actorId, until);
            return suppressed;
        });
    }

    /**
     * Returns a suppressed alert to active.
     *
     * @throws IllegalArgumentException if the alert does not exist for the tenant
     * @throws IllegalStateException    if the alert is not suppressed
     */
    public Alert unsuppress(String tenantId, String alertId, String actorId) {
        TenantContext.checkAccess(tenantId);
        return lock.withLock(alertLockKey(tenantId, alertId), () -> {
            Alert alert = require(tenantId, alertId);
            if (alert.getStatus() != AlertStatus.SUPPRESSED) {
                throw new IllegalStateException("Alert " + alertId + " is " + alert.getStatus() + ", not SUPPRESSED");
            }
            Alert active = reactivate(alert);
            store.update(List.of(active));
            auditService.record(tenantId, AuditAction.ALERT_UNSUPPRESSED, alertId, actorId,
                    alert.auditState(), active.auditState());
            log.info("alert.unsuppressed alertId={} actor={}", alertId, actorId);
            return active;
        });
    }

    /**
     * Reactivates every suppressed alert of the tenant whose suppression ended at or before {@code now}.
     * An alert unsuppressed by an operator in the meantime is left alone.
     *
     * @return the number of alerts reactivated
     */
    public int reactivateExpired(String tenantId, Instant now) {
        List<Alert> expired = store.find(tenantId, a -> isExpired(a, now));
        int reactivated = 0;
        for (Alert candidate : expired) {
            boolean done = lock.withLock(alertLockKey(tenantId, candidate.getId()), () -> {
                Alert alert = store.get(tenantId, candidate.getId()).orElse(null);
                if (alert == null || !isExpired(alert, now)) {
                    return false;
                }
                Alert active = reactivate(alert);
                store.update(List.of(active));
                auditService.record(tenantId, AuditAction.ALERT_SUPPRESSION_EXPIRED, alert.getId(),
                        AuditService.SYSTEM_ACTOR, alert.auditState(), active.auditState());
                return true;
            });
            if (done) {
                reactivated++;
            }
        }
        if (reactivated > 0) {
            log.info("alerts.suppression.expired count={}", reactivated);
        }
        return reactivated;
    }

    public Optional<Alert> get(String tenantId, String alertId) {
        return store.get(tenantId, alertId);
    }

    public List<Alert> findUnresolved(String tenantId, String dataSourceId) {
        return store.find(tenantId, a -> !a.isResolved() && Objects.equals(dataSourceId, a.getDataSourceId()));
    }

    public List<Alert> findByEntity(String tenantId, String entityId) {
        return store.find(tenantId, a -> entityId.equals(a.getEntityId()));
    }

    private Alert require(String tenantId, String alertId) {
        return store.get(tenantId, alertId)
                .orElseThrow(() -> new IllegalArgumentException("Alert not found: " + alertId));
    }

    private static Alert reactivate(Alert alert) {
        return alert.toBuilder()
                .status(AlertStatus.ACTIVE)
                .suppressedBy(null)
                .suppressionReason(null)
                .suppressedAt(null)
                .suppressedUntil(null)
                .build();
    }

    private static boolean isExpired(Alert alert, Instant now) {
        return alert.getStatus() == AlertStatus.SUPPRESSED
                && alert.getSuppressedUntil() != null && !alert.getSuppressedUntil().isAfter(now);
    }

    static String alertLockKey(String tenantId, String alertId) {
        return DistributedLock.key("alert", tenantId, alertId);
    }

    /**
     * Counts of one reconciliation. Reopened alerts count as created.
     */
    public record ReconcileResult(int created, int refreshed, int resolved) {
    }
}
