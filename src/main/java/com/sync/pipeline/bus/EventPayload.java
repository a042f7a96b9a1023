package com.sync.pipeline.bus;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Stage-specific body of an {@link EventEnvelope}, serialized with a {@code kind} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SyncPayload.class, name = "sync"),
        @JsonSubTypes.Type(value = FetchedPayload.class, name = "fetched"),
        @JsonSubTypes.Type(value = ProcessedPayload.class, name = "processed"),
        @JsonSubTypes.Type(value = LinkedPayload.class, name = "linked"),
        @JsonSubTypes.Type(value = CompletedPayload.class, name = "completed"),
        @JsonSubTypes.Type(value = FailedPayload.class, name = "failed")
})
public interface EventPayload {

    SyncMetadata syncMetadata();
}
