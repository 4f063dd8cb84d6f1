package com.waypoint.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkUnitTest {

    private static final Instant T0 = Instant.parse("2026-02-01T09:00:00Z");

    @Test
    @DisplayName("new work units start in backlog with one history entry")
    void create() {
        WorkUnit unit = WorkUnit.create("AUTH-001", "Login", WorkUnitType.STORY, T0);

        assertEquals(WorkUnitStatus.BACKLOG, unit.status());
        assertEquals(List.of(new StateHistoryEntry(WorkUnitStatus.BACKLOG, T0)), unit.stateHistory());
        assertEquals(T0, unit.createdAt());
    }

    @Test
    @DisplayName("missing collections and enums get defaults")
    void defaults() {
        var unit = new WorkUnit("X-1", null, null, null, null, null, null, null, null, null, null, null);

        assertEquals(WorkUnitType.STORY, unit.type());
        assertEquals(WorkUnitStatus.BACKLOG, unit.status());
        assertTrue(unit.stateHistory().isEmpty());
        assertTrue(unit.virtualHooks().isEmpty());
        assertTrue(unit.tags().isEmpty());
    }

    @Test
    @DisplayName("prefix is everything before the last dash")
    void prefix() {
        assertEquals("AUTH", WorkUnit.create("AUTH-001", "t", null, T0).prefix());
        assertEquals("WEB-API", WorkUnit.create("WEB-API-12", "t", null, T0).prefix());
        assertEquals("SOLO", WorkUnit.create("SOLO", "t", null, T0).prefix());
    }

    @Nested
    @DisplayName("withTransition")
    class WithTransition {

        @Test
        @DisplayName("appends exactly one entry and moves the status")
        void appends() {
            WorkUnit unit = WorkUnit.create("AUTH-001", "Login", WorkUnitType.STORY, T0);

            WorkUnit moved = unit.withTransition(WorkUnitStatus.SPECIFYING, T0.plusSeconds(60), null);

            assertEquals(WorkUnitStatus.SPECIFYING, moved.status());
            assertEquals(2, moved.stateHistory().size());
            assertEquals(WorkUnitStatus.SPECIFYING, moved.stateHistory().get(1).state());
            assertEquals(T0.plusSeconds(60), moved.updatedAt());
            assertEquals(1, unit.stateHistory().size());
        }

        @Test
        @DisplayName("a clock that went backwards never makes history decrease")
        void clampsTimestamp() {
            WorkUnit unit = WorkUnit.create("AUTH-001", "Login", WorkUnitType.STORY, T0);

            WorkUnit moved = unit.withTransition(WorkUnitStatus.SPECIFYING, T0.minusSeconds(30), null);

            assertEquals(T0, moved.stateHistory().get(1).timestamp());
        }

        @Test
        @DisplayName("entering blocked records the reason and leaving clears it")
        void blockedReason() {
            WorkUnit blocked = WorkUnit.create("AUTH-001", "Login", WorkUnitType.STORY, T0)
                    .withTransition(WorkUnitStatus.BLOCKED, T0.plusSeconds(1), "waiting on API");

            assertEquals("waiting on API", blocked.blockedReason());
            assertEquals("waiting on API", blocked.stateHistory().get(1).reason());

            WorkUnit resumed = blocked.withTransition(WorkUnitStatus.SPECIFYING, T0.plusSeconds(2), null);
            assertNull(resumed.blockedReason());
        }
    }

    @Test
    @DisplayName("lastEntryFor finds the most recent entry into a state")
    void lastEntryFor() {
        WorkUnit unit = WorkUnit.create("AUTH-001", "Login", WorkUnitType.STORY, T0)
                .withTransition(WorkUnitStatus.SPECIFYING, T0.plusSeconds(10), null)
                .withTransition(WorkUnitStatus.BACKLOG, T0.plusSeconds(20), null)
                .withTransition(WorkUnitStatus.SPECIFYING, T0.plusSeconds(30), null);

        assertEquals(T0.plusSeconds(30), unit.lastEntryFor(WorkUnitStatus.SPECIFYING).orElseThrow().timestamp());
        assertTrue(unit.lastEntryFor(WorkUnitStatus.DONE).isEmpty());
    }

    @Test
    @DisplayName("status values parse case-insensitively and reject unknown names")
    void statusParse() {
        assertEquals(WorkUnitStatus.IMPLEMENTING, WorkUnitStatus.parse("Implementing").orElseThrow());
        assertTrue(WorkUnitStatus.parse("shipping").isEmpty());
        assertEquals("validating", WorkUnitStatus.VALIDATING.toString());
    }
}
