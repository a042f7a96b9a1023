package com.sync.pipeline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline stages. The wire name is the stage segment of a bus topic.
 */
public enum Stage {
    SYNC("sync"),
    FETCHED("fetched"),
    PROCESSED("processed"),
    LINKED("linked"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    Stage(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Stage fromWireName(String wireName) {
        for (Stage stage : values()) {
            if (stage.wireName.equals(wireName)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + wireName);
    }
}
