package com.sentinel.core.logging;

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
    @DisplayName("setRun puts sentinelTaskId and parentTaskId in MDC")
    void setRun() {
        MdcContext.setRun("SENTINEL-TASK-001", "TASK-001");
        assertEquals("SENTINEL-TASK-001", MDC.get("sentinelTaskId"));
        assertEquals("TASK-001", MDC.get("parentTaskId"));
    }

    @Test
    @DisplayName("clearTier removes only the tier")
    void clearTier() {
        MdcContext.setRun("SENTINEL-TASK-001", "TASK-001");
        MdcContext.setTier(2);
        assertEquals("2", MDC.get("tier"));

        MdcContext.clearTier();
        assertNull(MDC.get("tier"));
        assertEquals("SENTINEL-TASK-001", MDC.get("sentinelTaskId"));
    }

    @Test
    @DisplayName("clear removes all Sentinel keys")
    void clear() {
        MdcContext.setRun("SENTINEL-TASK-001", "TASK-001");
        MdcContext.setTier(1);
        MdcContext.clear();
        assertNull(MDC.get("sentinelTaskId"));
        assertNull(MDC.get("parentTaskId"));
        assertNull(MDC.get("tier"));
    }
}
