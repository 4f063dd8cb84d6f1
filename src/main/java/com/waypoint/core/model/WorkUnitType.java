package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkUnitType {
    STORY("story"),
    BUG("bug"),
    TASK("task");

    private final String value;

    WorkUnitType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static WorkUnitType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return STORY;
        }
        for (WorkUnitType type : values()) {
            if (type.value.equalsIgnoreCase(raw.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown work unit type: " + raw);
    }
}
