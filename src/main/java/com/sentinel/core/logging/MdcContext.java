package com.sentinel.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Sentinel-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String sentinelTaskId, String parentTaskId) {
        MDC.put("sentinelTaskId", sentinelTaskId);
        MDC.put("parentTaskId", parentTaskId);
    }

    public static void setTier(int tier) {
        MDC.put("tier", String.valueOf(tier));
    }

    public static void clearTier() {
        MDC.remove("tier");
    }

    public static void clear() {
        MDC.remove("sentinelTaskId");
        MDC.remove("parentTaskId");
        MDC.remove("tier");
    }
}
