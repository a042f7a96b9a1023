package com.sync.pipeline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical entity types produced by the pipeline.
 * The wire name is the segment used in bus topics and scheduling configuration.
 */
public enum EntityType {
    IDENTITIES("identities"),
    GROUPS("groups"),
    ROLES("roles"),
    POLICIES("policies"),
    LICENSES("licenses"),
    COMPANIES("companies"),
    SITES("sites"),
    ENDPOINTS("endpoints"),
    FIREWALLS("firewalls");

    private final String wireName;

    EntityType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves an entity type from its wire name.
     *
     * @throws IllegalArgumentException if no entity type has that name
     */
    @JsonCreator
    public static EntityType fromWireName(String wireName) {
        for (EntityType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + wireName);
    }
}
