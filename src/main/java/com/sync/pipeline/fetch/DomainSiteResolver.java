package com.sync.pipeline.fetch;

import com.sync.pipeline.connector.VendorRecord;
import com.sync.pipeline.core.model.DataSource;
import com.sync.pipeline.core.model.EntityType;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves sites for identities from the domain of their principal name, using the
 * {@code domainMappings} of the data source. A data source bound to a site assigns that
 * site to every record.
 */
public class DomainSiteResolver implements SiteResolver {

    private static final List<String> PRINCIPAL_FIELDS = List.of("userPrincipalName", "mail");

    @Override
    public String resolve(DataSource dataSource, EntityType entityType, VendorRecord record) {
        if (dataSource == null) {
            return null;
        }
        if (dataSource.getSiteId() != null) {
            return dataSource.getSiteId();
        }
        String principal = principalName(record);
        if (principal == null) {
            return null;
        }
        String lower = principal.toLowerCase(Locale.ROOT);
        for (Map<String, Object> mapping : dataSource.getDomainMappings()) {
            Object domain = mapping.get("domain");
            Object siteId = mapping.get("siteId");
            if (domain != null && siteId != null && lower.endsWith(domain.toString().toLowerCase(Locale.ROOT))) {
                return siteId.toString();
            }
        }
        return null;
    }

    private static String principalName(VendorRecord record) {
        for (String field : PRINCIPAL_FIELDS) {
            Object value = record.data().get(field);
            if (value instanceof String text && !text.isBlank()) {
                return text;
            }
        }
        return null;
    }
}
