package com.sync.pipeline.connector;

import com.sync.pipeline.core.model.DataSource;

import java.util.Objects;

/**
 * Parameters of one page fetch.
 *
 * @param tenantId   tenant the data belongs to
 * @param dataSource data source configuration, null for tenant-wide integrations without one
 * @param cursor     vendor cursor of the page, null for the first page
 * @param pageSize   maximum records to return
 */
public record FetchRequest(String tenantId, DataSource dataSource, String cursor, int pageSize) {

    public FetchRequest {
        Objects.requireNonNull(tenantId, "tenantId is required");
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0");
        }
    }
}
