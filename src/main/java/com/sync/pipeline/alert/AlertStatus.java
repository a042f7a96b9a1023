package com.sync.pipeline.alert;

/**
 * Lifecycle of an alert. Operators move alerts between ACTIVE and SUPPRESSED;
 * analysis resolves them when the condition no longer holds.
 */
public enum AlertStatus {
    ACTIVE,
    SUPPRESSED,
    RESOLVED
}
