package com.sync.pipeline.audit;

import java.time.Instant;
import java.util.List;

/**
 * Append-only persistence of audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findByTenant(String tenantId);

    /**
     * Gets the entries of one audited record, oldest first.
     */
    List<AuditEntry> findByTargetId(String tenantId, String targetId);

    List<AuditEntry> findByAction(String tenantId, AuditAction action);

    List<AuditEntry> findBetween(String tenantId, Instant start, Instant end);

    int count();
}
