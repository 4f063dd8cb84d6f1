package com.waypoint.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTransition puts the unit id and from->to in MDC")
    void setTransition() {
        MdcContext.setTransition("AUTH-001", "testing", "implementing");
        assertEquals("AUTH-001", MDC.get("workUnitId"));
        assertEquals("testing->implementing", MDC.get("transition"));
    }

    @Test
    @DisplayName("clearHook leaves the transition keys in place")
    void clearHook() {
        MdcContext.setTransition("AUTH-001", "testing", "implementing");
        MdcContext.setHook("lint", "pre-implementing");
        assertEquals("lint", MDC.get("hook"));

        MdcContext.clearHook();

        assertNull(MDC.get("hook"));
        assertNull(MDC.get("hookEvent"));
        assertEquals("AUTH-001", MDC.get("workUnitId"));
    }

    @Test
    @DisplayName("clear removes all waypoint MDC keys")
    void clear() {
        MdcContext.setWorkUnit("AUTH-001");
        MdcContext.setTransition("AUTH-001", "a", "b");
        MdcContext.setHook("lint", "pre-testing");

        MdcContext.clear();

        assertNull(MDC.get("workUnitId"));
        assertNull(MDC.get("transition"));
        assertNull(MDC.get("hook"));
        assertNull(MDC.get("hookEvent"));
    }
}
