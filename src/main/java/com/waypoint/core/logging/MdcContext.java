package com.waypoint.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Waypoint-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkUnit(String workUnitId) {
        MDC.put("workUnitId", workUnitId);
    }

    public static void setTransition(String workUnitId, String fromState, String toState) {
        MDC.put("workUnitId", workUnitId);
        MDC.put("transition", fromState + "->" + toState);
    }

    public static void setHook(String hookName, String event) {
        MDC.put("hook", hookName);
        MDC.put("hookEvent", event);
    }

    public static void clearHook() {
        MDC.remove("hook");
        MDC.remove("hookEvent");
    }

    public static void clear() {
        MDC.remove("workUnitId");
        MDC.remove("transition");
        clearHook();
    }
}
