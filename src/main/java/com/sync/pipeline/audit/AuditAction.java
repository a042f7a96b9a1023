package com.sync.pipeline.audit;

/**
 * Operator and system actions that are written to the audit log.
 */
public enum AuditAction {
    ALERT_SUPPRESSED,
    ALERT_UNSUPPRESSED,
    ALERT_SUPPRESSION_EXPIRED
}
