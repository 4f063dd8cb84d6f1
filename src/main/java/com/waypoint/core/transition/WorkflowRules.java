package com.waypoint.core.transition;

import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.model.WorkUnitStatus;
import com.waypoint.core.model.WorkUnitType;
import com.waypoint.core.workunit.InvalidTargetException;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.waypoint.core.model.WorkUnitStatus.*;

/**
 * Which lifecycle moves are allowed.
 * <p>
 * Work flows forward one state at a time and may step back to any earlier working state.
 * Only {@code blocked} can return to {@code backlog}. Tasks have no test phase, so they skip
 * {@code testing} and may go straight from {@code specifying} to {@code implementing}.
 * Staying in the current state is always allowed.
 */
public final class WorkflowRules {

    private static final Map<WorkUnitStatus, Set<WorkUnitStatus>> ALLOWED = new EnumMap<>(WorkUnitStatus.class);

    static {
        ALLOWED.put(BACKLOG, EnumSet.of(SPECIFYING, BLOCKED));
        ALLOWED.put(SPECIFYING, EnumSet.of(TESTING, BLOCKED));
        ALLOWED.put(TESTING, EnumSet.of(IMPLEMENTING, SPECIFYING, BLOCKED));
        ALLOWED.put(IMPLEMENTING, EnumSet.of(VALIDATING, TESTING, SPECIFYING, BLOCKED));
        ALLOWED.put(VALIDATING, EnumSet.of(DONE, IMPLEMENTING, TESTING, SPECIFYING, BLOCKED));
        ALLOWED.put(DONE, EnumSet.of(SPECIFYING, TESTING, IMPLEMENTING, VALIDATING, BLOCKED));
        ALLOWED.put(BLOCKED, EnumSet.of(BACKLOG, SPECIFYING, TESTING, IMPLEMENTING, VALIDATING));
    }

    private WorkflowRules() {}

    public static boolean isAllowed(WorkUnitType type, WorkUnitStatus from, WorkUnitStatus to) {
        if (from == to) {
            return true;
        }
        if (type == WorkUnitType.TASK) {
            if (to == TESTING) {
                return false;
            }
            if (from == SPECIFYING && to == IMPLEMENTING) {
                return true;
            }
        }
        return ALLOWED.get(from).contains(to);
    }

    /**
     * @throws InvalidTargetException if the move is not allowed or a block has no reason
     */
    public static void check(WorkUnit unit, WorkUnitStatus to, String blockedReason) {
        WorkUnitStatus from = unit.status();
        if (unit.type() == WorkUnitType.TASK && to == TESTING) {
            throw new InvalidTargetException("Task %s has no testing phase; move it from specifying to implementing"
                    .formatted(unit.id()));
        }
        if (!isAllowed(unit.type(), from, to)) {
            throw new InvalidTargetException("Cannot move %s from %s to %s".formatted(unit.id(), from, to));
        }
        if (to == BLOCKED && (blockedReason == null || blockedReason.isBlank())) {
            throw new InvalidTargetException("Moving %s to blocked requires a reason".formatted(unit.id()));
        }
    }
}
