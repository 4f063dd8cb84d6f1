package com.waypoint.core.hooks;

import com.waypoint.core.model.HookCondition;
import com.waypoint.core.model.HookDefinition;
import com.waypoint.core.model.WorkUnit;

/**
 * Decides whether a hook applies to a work unit.
 */
public final class HookConditionEvaluator {

    private HookConditionEvaluator() {}

    /**
     * Unconditional hooks always match. A conditional hook matches only a work unit that
     * satisfies every criterion present: any listed tag, any listed id prefix, the epic,
     * and the estimate range (inclusive; units without an estimate never match a range).
     */
    public static boolean matches(HookDefinition hook, WorkUnit workUnit) {
        if (hook.isUnconditional()) {
            return true;
        }
        if (workUnit == null) {
            return false;
        }
        HookCondition c = hook.condition();

        if (!c.tags().isEmpty() && c.tags().stream().noneMatch(workUnit.tags()::contains)) {
            return false;
        }
        if (!c.prefix().isEmpty() && c.prefix().stream().noneMatch(p -> matchesPrefix(workUnit, p))) {
            return false;
        }
        if (c.epic() != null && !c.epic().equals(workUnit.epic())) {
            return false;
        }
        if (c.estimateMin() != null || c.estimateMax() != null) {
            Integer estimate = workUnit.estimate();
            if (estimate == null) {
                return false;
            }
            if (c.estimateMin() != null && estimate < c.estimateMin()) {
                return false;
            }
            if (c.estimateMax() != null && estimate > c.estimateMax()) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesPrefix(WorkUnit workUnit, String prefix) {
        return workUnit.prefix().equals(prefix) || workUnit.id().startsWith(prefix + "-");
    }
}
