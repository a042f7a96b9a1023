package com.sync.pipeline.alert;

import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.store.TenantDocument;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A stored alert. Unique per tenant, data source and fingerprint; an alert raised again
 * after resolution reopens the same record.
 */
public final class Alert implements TenantDocument {

    private final String id;
    private final String tenantId;
    private final String dataSourceId;
    private final String alertType;
    private final String entityId;
    private final EntityType entityType;
    private final AlertSeverity severity;
    private final String message;
    private final Map<String, Object> details;
    private final AlertStatus status;
    private final String suppressedBy;
    private final String suppressionReason;
    private final Instant suppressedAt;
    private final Instant suppressedUntil;
    private final Instant createdAt;
    private final Instant lastSeenAt;
    private final Instant resolvedAt;

    private Alert(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.dataSourceId = builder.dataSourceId;
        this.alertType = Objects.requireNonNull(builder.alertType, "alertType is required");
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId is required");
        this.entityType = builder.entityType;
        this.severity = Objects.requireNonNull(builder.severity, "severity is required");
        this.message = builder.message;
        this.details = builder.details != null ? Map.copyOf(builder.details) : Map.of();
        this.status = builder.status != null ? builder.status : AlertStatus.ACTIVE;
        this.suppressedBy = builder.suppressedBy;
        this.suppressionReason = builder.suppressionReason;
        this.suppressedAt = builder.suppressedAt;
        this.suppressedUntil = builder.suppressedUntil;
        this.createdAt = builder.createdAt;
        this.lastSeenAt = builder.lastSeenAt;
        this.resolvedAt = builder.resolvedAt;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getTenantId() {
        return tenantId;
    }

    public String getDataSourceId() {
        return dataSourceId;
    }

    public String getAlertType() {
        return alertType;
    }

    public String getEntityId() {
        return entityId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public String getSuppressedBy() {
        return suppressedBy;
    }

    /**
     * Operator's note on why the alert was suppressed, if given.
     */
    public String getSuppressionReason() {
        return suppressionReason;
    }

    public Instant getSuppressedAt() {
        return suppressedAt;
    }

    public Instant getSuppressedUntil() {
        return suppressedUntil;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public String getFingerprint() {
        return AlertCandidate.fingerprint(alertType, entityId);
    }

    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }

    public Key key() {
        return new Key(tenantId, dataSourceId, getFingerprint());
    }

    /**
     * Fields captured in audit records.
     */
    Map<String, Object> auditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("status", status.name());
        state.put("suppressedBy", suppressedBy);
        state.put("suppressionReason", suppressionReason);
        state.put("suppressedUntil", suppressedUntil != null ? suppressedUntil.toString() : null);
        state.values().removeIf(Objects::isNull);
        return state;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tenantId(tenantId)
                .dataSourceId(dataSourceId)
                .alertType(alertType)
                .entityId(entityId)
                .entityType(entityType)
                .severity(severity)
                .message(message)
                .details(details)
                .status(status)
                .suppressedBy(suppressedBy)
                .suppressionReason(suppressionReason)
                .suppressedAt(suppressedAt)
                .suppressedUntil(suppressedUntil)
                .createdAt(createdAt)
                .lastSeenAt(lastSeenAt)
                .resolvedAt(resolvedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alert alert)) return false;
        return id.equals(alert.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", fingerprint='" + getFingerprint() + '\'' +
                ", severity=" + severity +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public record Key(String tenantId, String dataSourceId, String fingerprint) {
    }

    public static class Builder {
        private String id;
        private String tenantId;
        private String dataSourceId;
        private String alertType;
        private String entityId;
        private EntityType entityType;
        private AlertSeverity severity;
        private String message;
        private Map<String, Object> details;
        private AlertStatus status;
        private String suppressedBy;
        private String suppressionReason;
        private Instant suppressedAt;
        private Instant suppressedUntil;
        private Instant createdAt;
        private Instant lastSeenAt;
        private Instant resolvedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder dataSourceId(String dataSourceId) {
            this.dataSourceId = dataSourceId;
            return this;
        }

        public Builder alertType(String alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder suppressedBy(String suppressedBy) {
            this.suppressedBy = suppressedBy;
            return this;
        }

        public Builder suppressionReason(String suppressionReason) {
            this.suppressionReason = suppressionReason;
            return this;
        }

        public Builder suppressedAt(Instant suppressedAt) {
            this.suppressedAt = suppressedAt;
            return this;
        }

        public Builder suppressedUntil(Instant suppressedUntil) {
            this.suppressedUntil = suppressedUntil;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastSeenAt(Instant lastSeenAt) {
            this.lastSeenAt = lastSeenAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }
}
