package com.sync.pipeline.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Aggregates registered health checks into one status: the worst individual status wins.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worstStatus = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = runCheck(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", String.valueOf(result.message()),
                    "details", result.details()
            ));
            if (result.status().ordinal() > worstStatus.ordinal()) {
                worstStatus = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worstStatus, worstMessage, results);
    }

    private HealthStatus runCheck(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check.failed name={} error={}", check.getName(), e.getMessage());
            return HealthStatus.down("Health check threw: " + e.getMessage());
        }
    }

    public int size() {
        return checks.size();
    }
}
