package com.sentinel.core.health;

import java.util.Map;

/**
 * Health of one Sentinel dependency.
 *
 * @param component name shown by {@code sentinel health} ("local-tier", "cloud-tier", "audit-dir")
 * @param status    UP, DOWN, or DEGRADED when runs still work with reduced capability
 * @param detail    one-line explanation
 * @param metadata  endpoint, model or path the check looked at
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
