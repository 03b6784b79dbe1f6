package com.sentinel.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a Sentinel run, used for CLI watch output.
 *
 * @param eventType event type (e.g. "sentinel.started", "tier.completed", "wave.halted")
 * @param taskId    the Sentinel task this event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SentinelEvent(
    String eventType,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static SentinelEvent of(String eventType, String taskId, Map<String, Object> payload) {
        return new SentinelEvent(eventType, taskId, payload, Instant.now());
    }
}
