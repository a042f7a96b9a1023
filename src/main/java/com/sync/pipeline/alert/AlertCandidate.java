package com.sync.pipeline.alert;

import com.sync.pipeline.core.model.EntityType;

import java.util.Map;
import java.util.Objects;

/**
 * An alert condition detected by analysis, before reconciliation against stored alerts.
 *
 * @param alertType  rule identifier, e.g. {@code mfa_not_enforced}
 * @param entityId   internal id of the affected entity
 * @param entityType type of the affected entity
 * @param severity   severity of this occurrence
 * @param message    human readable description
 * @param details    rule-specific context
 */
public record AlertCandidate(String alertType, String entityId, EntityType entityType, AlertSeverity severity,
                             String message, Map<String, Object> details) {

    public AlertCandidate {
        Objects.requireNonNull(alertType, "alertType is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(severity, "severity is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String fingerprint() {
        return fingerprint(alertType, entityId);
    }

    /**
     * Identity of an alert: one per rule and entity.
     */
    public static String fingerprint(String alertType, String entityId) {
        return alertType + ":" + entityId;
    }
}
