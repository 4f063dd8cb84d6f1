package com.waypoint.core.hooks;

import com.waypoint.core.model.HookCondition;
import com.waypoint.core.model.HookDefinition;
import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.workunit.WorkUnitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds, removes and copies hooks: virtual hooks on a work unit, and global hooks in the
 * project configuration.
 */
public class HookManagementService {

    private static final Logger log = LoggerFactory.getLogger(HookManagementService.class);

    private final WorkUnitRepository repository;
    private final GlobalHookStore globalHooks;
    private final Clock clock;

    public HookManagementService(WorkUnitRepository repository, GlobalHookStore globalHooks, Clock clock) {
        this.repository = repository;
        this.globalHooks = globalHooks;
        this.clock = clock;
    }

    // --- virtual hooks ---

    public HookDefinition addVirtualHook(String workUnitId, String event, String name, String command,
                                         boolean blocking, boolean gitContext, Integer timeoutSeconds,
                                         HookCondition condition) {
        var hook = new HookDefinition(requireText(name, "name"), HookEvents.requireValid(event),
                requireText(command, "command"), blocking, timeoutSeconds, condition, gitContext);
        WorkUnit unit = repository.load(workUnitId);
        for (HookDefinition existing : unit.virtualHooks()) {
            if (existing.name().equals(hook.name()) && existing.event().equals(hook.event())) {
                throw new HookConfigurationException("Virtual hook '%s' already exists for %s on %s"
                        .formatted(hook.name(), hook.event(), workUnitId));
            }
        }
        var hooks = new ArrayList<>(unit.virtualHooks());
        hooks.add(hook);
        repository.save(unit.withVirtualHooks(hooks, clock.instant()));
        log.info("Added virtual hook '{}' ({}) to {}", hook.name(), hook.event(), workUnitId);
        return hook;
    }

    /**
     * Removes every virtual hook named {@code name} from the unit, whatever its event.
     *
     * @throws HookConfigurationException if the unit has no such hook
     */
    public void removeVirtualHook(String workUnitId, String name) {
        WorkUnit unit = repository.load(workUnitId);
        List<HookDefinition> remaining = unit.virtualHooks().stream()
                .filter(h -> !h.name().equals(name))
                .toList();
        if (remaining.size() == unit.virtualHooks().size()) {
            throw new HookConfigurationException("Virtual hook '%s' not found on %s".formatted(name, workUnitId));
        }
        repository.save(unit.withVirtualHooks(remaining, clock.instant()));
        log.info("Removed virtual hook '{}' from {}", name, workUnitId);
    }

    /**
     * Virtual hooks of the unit grouped by event, preserving attach order within each event.
     */
    public Map<String, List<HookDefinition>> listVirtualHooks(String workUnitId) {
        var grouped = new LinkedHashMap<String, List<HookDefinition>>();
        for (HookDefinition hook : repository.load(workUnitId).virtualHooks()) {
            grouped.computeIfAbsent(hook.event(), e -> new ArrayList<>()).add(hook);
        }
        return grouped;
    }

    /**
     * @return number of hooks removed
     */
    public int clearVirtualHooks(String workUnitId) {
        WorkUnit unit = repository.load(workUnitId);
        int count = unit.virtualHooks().size();
        if (count > 0) {
            repository.save(unit.withVirtualHooks(List.of(), clock.instant()));
            log.info("Cleared {} virtual hook(s) from {}", count, workUnitId);
        }
        return count;
    }

    /**
     * Copies virtual hooks from one unit to another, skipping hooks the target already has.
     *
     * @param hookName copy only this hook, or all hooks when {@code null}
     * @return the hooks that were copied
     */
    public List<HookDefinition> copyVirtualHooks(String fromWorkUnitId, String toWorkUnitId, String hookName) {
        WorkUnit source = repository.load(fromWorkUnitId);
        WorkUnit target = repository.load(toWorkUnitId);

        List<HookDefinition> candidates = source.virtualHooks().stream()
                .filter(h -> hookName == null || h.name().equals(hookName))
                .toList();
        if (hookName != null && candidates.isEmpty()) {
            throw new HookConfigurationException("Virtual hook '%s' not found on %s".formatted(hookName, fromWorkUnitId));
        }

        var merged = new ArrayList<>(target.virtualHooks());
        var copied = new ArrayList<HookDefinition>();
        for (HookDefinition hook : candidates) {
            boolean present = merged.stream()
                    .anyMatch(h -> h.name().equals(hook.name()) && h.event().equals(hook.event()));
            if (!present) {
                merged.add(hook);
                copied.add(hook);
            }
        }
        if (!copied.isEmpty()) {
            repository.save(target.withVirtualHooks(merged, clock.instant()));
        }
        log.info("Copied {} virtual hook(s) from {} to {}", copied.size(), fromWorkUnitId, toWorkUnitId);
        return copied;
    }

    // --- global hooks ---

    public HookDefinition addGlobalHook(String event, String name, String command, boolean blocking,
                                        Integer timeoutSeconds, HookCondition condition) {
        var hook = new HookDefinition(requireText(name, "name"), HookEvents.requireValid(event),
                requireText(command, "command"), blocking, timeoutSeconds, condition, false);
        globalHooks.add(hook);
        return hook;
    }

    public void removeGlobalHook(String event, String name) {
        if (!globalHooks.remove(HookEvents.requireValid(event), name)) {
            throw new HookConfigurationException("Global hook '%s' not found for %s".formatted(name, event));
        }
    }

    public Map<String, List<HookDefinition>> listGlobalHooks() {
        return globalHooks.all();
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new HookConfigurationException("Hook " + field + " must not be blank");
        }
        return value;
    }
}
