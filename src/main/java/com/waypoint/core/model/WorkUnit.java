package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A trackable unit of work with a lifecycle status and an append-only state history.
 * <p>
 * Instances are immutable. The transition coordinator derives a new instance with
 * {@link #withTransition} and the hook management operations with
 * {@link #withVirtualHooks}; the repository persists whichever copy it is handed.
 * The last history entry always names the current status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkUnit(
    String id,
    String title,
    WorkUnitType type,
    WorkUnitStatus status,
    List<StateHistoryEntry> stateHistory,
    List<HookDefinition> virtualHooks,
    List<String> tags,
    String epic,
    Integer estimate,
    String blockedReason,
    Instant createdAt,
    Instant updatedAt
) {
    public WorkUnit {
        type = type == null ? WorkUnitType.STORY : type;
        status = status == null ? WorkUnitStatus.BACKLOG : status;
        stateHistory = stateHistory == null ? List.of() : List.copyOf(stateHistory);
        virtualHooks = virtualHooks == null ? List.of() : List.copyOf(virtualHooks);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Files a new work unit in {@code backlog}.
     */
    public static WorkUnit create(String id, String title, WorkUnitType type, Instant now) {
        return new WorkUnit(id, title, type, WorkUnitStatus.BACKLOG,
                List.of(new StateHistoryEntry(WorkUnitStatus.BACKLOG, now)),
                List.of(), List.of(), null, null, null, now, now);
    }

    /**
     * The namespace part of the id: everything before the last dash ({@code AUTH} for {@code AUTH-001}).
     */
    public String prefix() {
        int dash = id.lastIndexOf('-');
        return dash > 0 ? id.substring(0, dash) : id;
    }

    /**
     * Most recent history entry for the given state, i.e. when the unit last entered it.
     */
    public Optional<StateHistoryEntry> lastEntryFor(WorkUnitStatus state) {
        for (int i = stateHistory.size() - 1; i >= 0; i--) {
            if (stateHistory.get(i).state() == state) {
                return Optional.of(stateHistory.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy moved to {@code target} with one history entry appended.
     * The entry timestamp never precedes the previous entry's, so history stays
     * non-decreasing even if the clock steps backwards. Entering {@code blocked}
     * records {@code reason}; any other target clears the blocked reason.
     */
    public WorkUnit withTransition(WorkUnitStatus target, Instant at, String reason) {
        Instant timestamp = at;
        if (!stateHistory.isEmpty()) {
            Instant last = stateHistory.get(stateHistory.size() - 1).timestamp();
            if (last != null && at.isBefore(last)) {
                timestamp = last;
            }
        }
        boolean blocked = target == WorkUnitStatus.BLOCKED;
        var history = new ArrayList<>(stateHistory);
        history.add(new StateHistoryEntry(target, timestamp, blocked ? reason : null));
        return new WorkUnit(id, title, type, target, history, virtualHooks, tags, epic, estimate,
                blocked ? reason : null, createdAt, timestamp);
    }

    public WorkUnit withVirtualHooks(List<HookDefinition> hooks, Instant now) {
        return new WorkUnit(id, title, type, status, stateHistory, hooks, tags, epic, estimate,
                blockedReason, createdAt, now);
    }

    public WorkUnit withTags(List<String> newTags) {
        return new WorkUnit(id, title, type, status, stateHistory, virtualHooks, newTags, epic, estimate,
                blockedReason, createdAt, updatedAt);
    }

    public WorkUnit withEpic(String newEpic) {
        return new WorkUnit(id, title, type, status, stateHistory, virtualHooks, tags, newEpic, estimate,
                blockedReason, createdAt, updatedAt);
    }

    public WorkUnit withEstimate(Integer newEstimate) {
        return new WorkUnit(id, title, type, status, stateHistory, virtualHooks, tags, epic, newEstimate,
                blockedReason, createdAt, updatedAt);
    }
}
