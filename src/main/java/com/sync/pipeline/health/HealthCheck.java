package com.sync.pipeline.health;

/**
 * Health check of one pipeline component (queue, connector, bus).
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
