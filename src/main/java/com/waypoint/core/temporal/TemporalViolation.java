package com.waypoint.core.temporal;

import com.waypoint.core.model.WorkUnitStatus;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * An artifact last modified at or before the moment its owning state was entered.
 */
public record TemporalViolation(
    Path path,
    Instant modifiedAt,
    WorkUnitStatus sourceState,
    Instant stateEnteredAt
) {
    /**
     * How long before the state entry the file was last touched.
     */
    public Duration gap() {
        return Duration.between(modifiedAt, stateEnteredAt);
    }

    public String describe() {
        return "%s modified %s, %s before entering %s at %s".formatted(
                path, modifiedAt, formatGap(gap()), sourceState, stateEnteredAt);
    }

    private static String formatGap(Duration gap) {
        long seconds = gap.getSeconds();
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }
}
