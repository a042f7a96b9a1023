package com.sync.pipeline.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Records and queries audit entries.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "system";

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository(), Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public AuditEntry record(String tenantId, AuditAction action, String targetId, String actorId,
                             Map<String, Object> before, Map<String, Object> after) {
        AuditEntry entry = AuditEntry.builder()
                .tenantId(tenantId)
                .action(action)
                .targetId(targetId)
                .actorId(actorId)
                .before(before)
                .after(after)
                .timestamp(clock.instant())
                .build();
        repository.save(entry);
        log.debug("audit.recorded action={} targetId={} actor={}", action, targetId, actorId);
        return entry;
    }

    public List<AuditEntry> getEntriesFor(String tenantId, String targetId) {
        return repository.findByTargetId(tenantId, targetId);
    }

    public List<AuditEntry> getEntriesByAction(String tenantId, AuditAction action) {
        return repository.findByAction(tenantId, action);
    }

    public int size() {
        return repository.count();
    }
}
