package com.waypoint.core.hooks;

import com.waypoint.core.model.WorkUnitStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HookEventsTest {

    @Test
    @DisplayName("event names are phase dash state")
    void names() {
        assertEquals("pre-implementing", HookEvents.pre(WorkUnitStatus.IMPLEMENTING));
        assertEquals("post-done", HookEvents.post(WorkUnitStatus.DONE));
    }

    @Test
    @DisplayName("requireValid normalizes case and rejects unknown events")
    void requireValid() {
        assertEquals("post-validating", HookEvents.requireValid(" Post-Validating "));
        assertThrows(HookConfigurationException.class, () -> HookEvents.requireValid("pre-shipping"));
        assertThrows(HookConfigurationException.class, () -> HookEvents.requireValid("during-testing"));
        assertThrows(HookConfigurationException.class, () -> HookEvents.requireValid(null));
    }
}
