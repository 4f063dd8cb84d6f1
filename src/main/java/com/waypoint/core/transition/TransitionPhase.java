package com.waypoint.core.transition;

/**
 * Progress of one transition request. An aborted request stays at the last phase it reached.
 */
public enum TransitionPhase {
    PENDING,
    CHECKPOINTED,
    PRE_HOOKED,
    VALIDATED,
    COMMITTED,
    POST_HOOKED
}
