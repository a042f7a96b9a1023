package com.sync.pipeline.connector;

import com.sync.pipeline.core.model.DataSource;
import com.sync.pipeline.core.model.EntityType;

import java.util.Set;

/**
 * Access to one vendor API, keyed by integration type.
 *
 * <p>Adding an integration means registering a new connector in the
 * {@link ConnectorRegistry}; the pipeline itself does not change.</p>
 */
public interface Connector {

    /**
     * Integration type this connector serves, e.g. {@code microsoft-365}.
     */
    String integrationType();

    Set<EntityType> supportedEntityTypes();

    /**
     * Verifies credentials and reachability for a data source.
     */
    ConnectorHealth checkHealth(DataSource dataSource);

    /**
     * Fetches one page of raw records.
     *
     * @throws ConnectorException                                    on vendor or configuration failure
     * @throws com.sync.pipeline.core.UnsupportedEntityTypeException when the type is not supported
     */
    FetchPage fetch(EntityType entityType, FetchRequest request);

    default boolean supports(EntityType entityType) {
        return supportedEntityTypes().contains(entityType);
    }
}
