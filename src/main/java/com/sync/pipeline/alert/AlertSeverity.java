package com.sync.pipeline.alert;

import com.sync.pipeline.core.model.EntityState;

/**
 * Severity of an alert, in ascending order.
 */
public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Entity state implied by this severity being the highest active one.
     */
    public EntityState toEntityState() {
        return switch (this) {
            case CRITICAL, HIGH -> EntityState.CRITICAL;
            case MEDIUM -> EntityState.WARN;
            case LOW -> EntityState.LOW;
        };
    }
}
