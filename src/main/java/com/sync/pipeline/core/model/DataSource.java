package com.sync.pipeline.core.model;

import com.sync.pipeline.store.TenantDocument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A tenant's configured connection to one integration.
 * The {@code config} map is opaque to the pipeline except for {@code domainMappings}.
 */
public final class DataSource implements TenantDocument {

    private final String id;
    private final String tenantId;
    private final String integrationType;
    private final String siteId;
    private final Map<String, Object> config;

    private DataSource(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.integrationType = Objects.requireNonNull(builder.integrationType, "integrationType is required");
        this.siteId = builder.siteId;
        this.config = builder.config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.config))
                : Map.of();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    public String getIntegrationType() {
        return integrationType;
    }

    /**
     * Site this data source is bound to, or null for a tenant-wide data source.
     */
    public String getSiteId() {
        return siteId;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * Domain to site mappings declared in the configuration under {@code domainMappings},
     * as a list of {@code {domain, siteId}} objects.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getDomainMappings() {
        Object mappings = config.get("domainMappings");
        if (mappings instanceof List<?> list) {
            return (List<Map<String, Object>>) list;
        }
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataSource that = (DataSource) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DataSource{" +
                "id='" + id + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", integrationType='" + integrationType + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String tenantId;
        private String integrationType;
        private String siteId;
        private Map<String, Object> config;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder integrationType(String integrationType) {
            this.integrationType = integrationType;
            return this;
        }

        public Builder siteId(String siteId) {
            this.siteId = siteId;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public DataSource build() {
            return new DataSource(this);
        }
    }
}
