package com.waypoint.core.hooks;

import com.waypoint.core.model.HookDefinition;

import java.util.List;
import java.util.Map;

/**
 * Project-wide hook definitions, keyed by event in configuration order.
 */
public interface GlobalHookStore {

    Map<String, List<HookDefinition>> all();

    default List<HookDefinition> hooksFor(String event) {
        return all().getOrDefault(event, List.of());
    }

    void add(HookDefinition hook);

    /**
     * @return whether a hook was removed
     */
    boolean remove(String event, String name);
}
