package com.waypoint.core.temporal;

import com.waypoint.core.WaypointException;
import com.waypoint.core.model.WorkUnitStatus;

import java.util.List;

public class TemporalOrderingViolationException extends WaypointException {

    private final String workUnitId;
    private final WorkUnitStatus targetState;
    private final List<TemporalViolation> violations;

    public TemporalOrderingViolationException(String workUnitId, WorkUnitStatus targetState,
                                              List<TemporalViolation> violations) {
        super(buildMessage(workUnitId, targetState, violations));
        this.workUnitId = workUnitId;
        this.targetState = targetState;
        this.violations = List.copyOf(violations);
    }

    public String getWorkUnitId() {
        return workUnitId;
    }

    public WorkUnitStatus getTargetState() {
        return targetState;
    }

    public List<TemporalViolation> getViolations() {
        return violations;
    }

    private static String buildMessage(String workUnitId, WorkUnitStatus target, List<TemporalViolation> violations) {
        var sb = new StringBuilder("Cannot move %s to %s: %d artifact(s) were written before their state began"
                .formatted(workUnitId, target, violations.size()));
        for (TemporalViolation v : violations) {
            sb.append("\n  - ").append(v.describe());
        }
        return sb.toString();
    }
}
