package com.waypoint.core.temporal;

import java.util.List;

/**
 * Result of a temporal check. {@code checked} is false when the transition is not subject to one.
 */
public record TemporalValidation(boolean checked, List<TemporalViolation> violations) {

    public TemporalValidation {
        violations = List.copyOf(violations);
    }

    public static TemporalValidation notApplicable() {
        return new TemporalValidation(false, List.of());
    }

    public boolean ok() {
        return violations.isEmpty();
    }
}
