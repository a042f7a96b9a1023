package com.sync.pipeline.fetch;

import com.sync.pipeline.connector.VendorRecord;
import com.sync.pipeline.core.model.DataSource;
import com.sync.pipeline.core.model.EntityType;

/**
 * Associates a fetched record with a tenant site.
 */
@FunctionalInterface
public interface SiteResolver {

    /**
     * @return the site id, or null when the record belongs to no particular site
     */
    String resolve(DataSource dataSource, EntityType entityType, VendorRecord record);

    static SiteResolver none() {
        return (dataSource, entityType, record) -> null;
    }
}
