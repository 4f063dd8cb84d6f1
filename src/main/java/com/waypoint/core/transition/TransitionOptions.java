package com.waypoint.core.transition;

/**
 * @param skipTemporalValidation bypass the temporal check for this invocation only
 * @param blockedReason          required when the target is {@code blocked}
 */
public record TransitionOptions(boolean skipTemporalValidation, String blockedReason) {

    public static TransitionOptions defaults() {
        return new TransitionOptions(false, null);
    }

    public static TransitionOptions skippingTemporalValidation() {
        return new TransitionOptions(true, null);
    }

    public static TransitionOptions blocked(String reason) {
        return new TransitionOptions(false, reason);
    }
}
