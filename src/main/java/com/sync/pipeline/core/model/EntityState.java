package com.sync.pipeline.core.model;

/**
 * Derived risk state of an entity, assigned by analysis.
 * Declared in ascending order of severity.
 */
public enum EntityState {
    LOW,
    NORMAL,
    WARN,
    HIGH,
    CRITICAL
}
