package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CheckpointKind {
    MANUAL("manual"),
    AUTOMATIC("automatic");

    private final String value;

    CheckpointKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static CheckpointKind fromValue(String raw) {
        for (CheckpointKind kind : values()) {
            if (kind.value.equalsIgnoreCase(raw)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown checkpoint kind: " + raw);
    }
}
