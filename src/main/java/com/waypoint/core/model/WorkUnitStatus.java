package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle states of a work unit.
 */
public enum WorkUnitStatus {
    BACKLOG("backlog"),
    SPECIFYING("specifying"),
    TESTING("testing"),
    IMPLEMENTING("implementing"),
    VALIDATING("validating"),
    DONE("done"),
    BLOCKED("blocked");

    private final String value;

    WorkUnitStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<WorkUnitStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.value.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static WorkUnitStatus fromValue(String raw) {
        return parse(raw).orElseThrow(() ->
                new IllegalArgumentException("Unknown work unit status: " + raw));
    }

    @Override
    public String toString() {
        return value;
    }
}
