package com.sync.pipeline.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sync.pipeline.core.model.EntityType;

import java.util.Objects;

/**
 * How often one entity type of an integration is synced.
 *
 * @param type        entity type
 * @param global      true when the type is tenant-wide rather than per data source; only one
 *                    data source per tenant and integration syncs it
 * @param priority    job priority, lower runs first
 * @param rateMinutes interval between recurring syncs
 */
public record EntitySchedule(
        @JsonProperty("type") EntityType type,
        @JsonProperty("isGlobal") boolean global,
        @JsonProperty("priority") int priority,
        @JsonProperty("rateMinutes") int rateMinutes
) {
    public EntitySchedule {
        Objects.requireNonNull(type, "type is required");
        if (rateMinutes <= 0) {
            throw new IllegalArgumentException("rateMinutes must be > 0 for " + type.getWireName());
        }
    }
}
