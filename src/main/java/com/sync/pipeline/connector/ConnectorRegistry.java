package com.sync.pipeline.connector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connectors by integration type, populated at startup.
 */
public class ConnectorRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final Map<String, Connector> connectors = new ConcurrentHashMap<>();

    public ConnectorRegistry() {
    }

    public ConnectorRegistry(List<Connector> connectors) {
        connectors.forEach(this::register);
    }

    public ConnectorRegistry register(Connector connector) {
        Connector previous = connectors.put(connector.integrationType(), connector);
        if (previous != null) {
            log.warn("connector.replaced integrationType={}", connector.integrationType());
        }
        return this;
    }

    public Optional<Connector> find(String integrationType) {
        return Optional.ofNullable(connectors.get(integrationType));
    }

    /**
     * @throws ConnectorException of kind CONFIGURATION when no connector is registered
     */
    public Connector require(String integrationType) {
        Connector connector = connectors.get(integrationType);
        if (connector == null) {
            throw ConnectorException.configuration("No connector registered for integration " + integrationType);
        }
        return connector;
    }

    public Collection<Connector> all() {
        return List.copyOf(connectors.values());
    }
}
