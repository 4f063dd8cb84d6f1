package com.waypoint.core.hooks;

import com.waypoint.core.model.WorkUnitStatus;

/**
 * Lifecycle event names: {@code pre-<state>} and {@code post-<state>}.
 */
public final class HookEvents {

    private HookEvents() {}

    public static String of(HookPhase phase, WorkUnitStatus state) {
        return phase.prefix() + "-" + state.value();
    }

    public static String pre(WorkUnitStatus state) {
        return of(HookPhase.PRE, state);
    }

    public static String post(WorkUnitStatus state) {
        return of(HookPhase.POST, state);
    }

    /**
     * Normalizes and checks an event name supplied by a user or a config file.
     *
     * @throws HookConfigurationException if the name is not {@code pre-} or {@code post-} a known state
     */
    public static String requireValid(String event) {
        String normalized = event == null ? "" : event.trim().toLowerCase();
        for (HookPhase phase : HookPhase.values()) {
            String head = phase.prefix() + "-";
            if (normalized.startsWith(head)
                    && WorkUnitStatus.parse(normalized.substring(head.length())).isPresent()) {
                return normalized;
            }
        }
        throw new HookConfigurationException("Invalid hook event '" + event
                + "': expected pre-<state> or post-<state>");
    }
}
