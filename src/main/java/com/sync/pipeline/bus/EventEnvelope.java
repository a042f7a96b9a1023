package com.sync.pipeline.bus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Stage;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable envelope of every bus event.
 *
 * <p>Lineage: {@code traceId} is shared by every event descending from one job,
 * the span id of an event is its {@code eventId}, and {@code parentEventId} names the
 * event (or, for sync events, the job) that caused it.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EventEnvelope {

    private final String eventId;
    private final String parentEventId;
    private final String traceId;
    private final String tenantId;
    private final String integrationType;
    private final EntityType entityType;
    private final String dataSourceId;
    private final Stage stage;
    private final Instant createdAt;
    private final EventPayload payload;

    @JsonCreator
    EventEnvelope(@JsonProperty("eventID") String eventId,
                  @JsonProperty("parentEventID") String parentEventId,
                  @JsonProperty("traceID") String traceId,
                  @JsonProperty("tenantID") String tenantId,
                  @JsonProperty("integrationType") String integrationType,
                  @JsonProperty("entityType") EntityType entityType,
                  @JsonProperty("dataSourceID") String dataSourceId,
                  @JsonProperty("stage") Stage stage,
                  @JsonProperty("createdAt") Instant createdAt,
                  @JsonProperty("payload") EventPayload payload) {
        this.eventId = eventId != null ? eventId : UUID.randomUUID().toString();
        this.parentEventId = parentEventId;
        this.traceId = traceId != null ? traceId : UUID.randomUUID().toString();
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId is required");
        this.integrationType = Objects.requireNonNull(integrationType, "integrationType is required");
        this.entityType = Objects.requireNonNull(entityType, "entityType is required");
        this.dataSourceId = dataSourceId;
        this.stage = Objects.requireNonNull(stage, "stage is required");
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.payload = Objects.requireNonNull(payload, "payload is required");
    }

    /**
     * Starts a new lineage. Used by the job dispatcher for sync events.
     */
    public static EventEnvelope root(String parentId, String tenantId, String integrationType,
                                     EntityType entityType, String dataSourceId,
                                     Stage stage, EventPayload payload) {
        return new EventEnvelope(null, parentId, null, tenantId, integrationType, entityType,
                dataSourceId, stage, null, payload);
    }

    /**
     * Derives the next event of this lineage: same tenant, integration, entity type,
     * data source and trace; parent is this event.
     */
    public EventEnvelope next(Stage nextStage, EventPayload nextPayload) {
        return new EventEnvelope(null, eventId, traceId, tenantId, integrationType, entityType,
                dataSourceId, nextStage, null, nextPayload);
    }

    /**
     * Returns the topic this envelope is published on.
     */
    @JsonIgnore
    public String getTopic() {
        if (stage == Stage.SYNC) {
            return Topic.sync(integrationType, entityType);
        }
        return Topic.of(stage, entityType);
    }

    @JsonProperty("eventID")
    public String getEventId() {
        return eventId;
    }

    @JsonProperty("parentEventID")
    public String getParentEventId() {
        return parentEventId;
    }

    @JsonProperty("traceID")
    public String getTraceId() {
        return traceId;
    }

    @JsonIgnore
    public String getSpanId() {
        return eventId;
    }

    @JsonProperty("tenantID")
    public String getTenantId() {
        return tenantId;
    }

    @JsonProperty("integrationType")
    public String getIntegrationType() {
        return integrationType;
    }

    @JsonProperty("entityType")
    public EntityType getEntityType() {
        return entityType;
    }

    @JsonProperty("dataSourceID")
    public String getDataSourceId() {
        return dataSourceId;
    }

    @JsonProperty("stage")
    public Stage getStage() {
        return stage;
    }

    @JsonProperty("createdAt")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("payload")
    public EventPayload getPayload() {
        return payload;
    }

    /**
     * Returns the payload cast to the expected type.
     *
     * @throws IllegalStateException if the payload is of another type
     */
    public <P extends EventPayload> P payloadAs(Class<P> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("Event " + eventId + " carries " +
                    payload.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventEnvelope that = (EventEnvelope) o;
        return Objects.equals(eventId, that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "EventEnvelope{" +
                "eventId='" + eventId + '\'' +
                ", topic='" + getTopic() + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", parentEventId='" + parentEventId + '\'' +
                '}';
    }
}
