package com.sync.pipeline.audit;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AuditRepository.
 * Thread-safe via CopyOnWriteArrayList.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findByTenant(String tenantId) {
        return entries.stream()
                .filter(e -> tenantId.equals(e.tenantId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByTargetId(String tenantId, String targetId) {
        return entries.stream()
                .filter(e -> tenantId.equals(e.tenantId()) && targetId.equals(e.targetId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findByAction(String tenantId, AuditAction action) {
        return entries.stream()
                .filter(e -> tenantId.equals(e.tenantId()) && e.action() == action)
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEntry> findBetween(String tenantId, Instant start, Instant end) {
        return entries.stream()
                .filter(e -> tenantId.equals(e.tenantId()))
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .collect(Collectors.toList());
    }

    @Override
    public int count() {
        return entries.size();
    }
}
