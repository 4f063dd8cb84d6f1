package com.waypoint.core.transition;

public enum TransitionOutcome {
    /** State changed and all blocking hooks passed. */
    COMMITTED,
    /** A blocking pre-hook failed; nothing was persisted. */
    ABORTED_BY_PRE_HOOK,
    /** Artifacts failed the temporal check; nothing was persisted. */
    ABORTED_BY_TEMPORAL_VIOLATION,
    /** State changed but a blocking post-hook failed. The change is kept. */
    COMMITTED_WITH_POST_HOOK_FAILURE;

    public boolean committed() {
        return this == COMMITTED || this == COMMITTED_WITH_POST_HOOK_FAILURE;
    }

    public int exitCode() {
        return this == COMMITTED ? 0 : 1;
    }
}
