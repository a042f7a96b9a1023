package com.sync.pipeline.connector;

import com.sync.pipeline.core.model.DataSource;
import com.sync.pipeline.health.HealthCheck;
import com.sync.pipeline.health.HealthStatus;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Checks the connector of every known data source.
 * DOWN when every check fails, DEGRADED when some fail.
 */
public class ConnectorHealthCheck implements HealthCheck {

    private final ConnectorRegistry registry;
    private final Supplier<? extends Collection<DataSource>> dataSources;

    public ConnectorHealthCheck(ConnectorRegistry registry, Supplier<? extends Collection<DataSource>> dataSources) {
        this.registry = registry;
        this.dataSources = dataSources;
    }

    @Override
    public String getName() {
        return "connectors";
    }

    @Override
    public HealthStatus check() {
        Collection<DataSource> sources = dataSources.get();
        if (sources.isEmpty()) {
            return HealthStatus.up("No data sources configured");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        int failing = 0;
        for (DataSource source : sources) {
            ConnectorHealth health = checkOne(source);
            details.put(source.getId(), health.ok() ? "UP" : health.message());
            if (!health.ok()) {
                failing++;
            }
        }
        if (failing == 0) {
            return HealthStatus.up().withDetails(details);
        }
        String message = failing + " of " + sources.size() + " data sources failing";
        HealthStatus status = failing == sources.size() ? HealthStatus.down(message) : HealthStatus.degraded(message);
        return status.withDetails(details);
    }

    private ConnectorHealth checkOne(DataSource source) {
        Optional<Connector> connector = registry.find(source.getIntegrationType());
        if (connector.isEmpty()) {
            return ConnectorHealth.unhealthy("No connector for " + source.getIntegrationType());
        }
        try {
            return connector.get().checkHealth(source);
        } catch (RuntimeException e) {
            return ConnectorHealth.unavailable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
