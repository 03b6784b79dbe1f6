package com.sentinel.core.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private final EventBus bus = new EventBus();

    @Test
    @DisplayName("Task subscribers receive only their task's events; global ones receive all")
    void routing() {
        List<String> taskEvents = new ArrayList<>();
        List<String> allEvents = new ArrayList<>();
        bus.subscribe("SENTINEL-TASK-001", e -> taskEvents.add(e.eventType()));
        bus.subscribeAll(e -> allEvents.add(e.taskId()));

        bus.publish(SentinelEvent.of("sentinel.started", "SENTINEL-TASK-001", Map.of()));
        bus.publish(SentinelEvent.of("sentinel.started", "SENTINEL-TASK-002", Map.of()));

        assertEquals(List.of("sentinel.started"), taskEvents);
        assertEquals(List.of("SENTINEL-TASK-001", "SENTINEL-TASK-002"), allEvents);
    }

    @Test
    @DisplayName("Unsubscribed consumers stop receiving events")
    void unsubscribe() {
        List<String> received = new ArrayList<>();
        var subscription = bus.subscribe("T", e -> received.add(e.eventType()));

        bus.publish(SentinelEvent.of("a", "T", Map.of()));
        subscription.unsubscribe();
        bus.publish(SentinelEvent.of("b", "T", Map.of()));

        assertEquals(List.of("a"), received);
        assertFalse(bus.hasSubscribers("T"));
    }

    @Test
    @DisplayName("hasSubscribers sees task and global subscriptions")
    void hasSubscribers() {
        assertFalse(bus.hasSubscribers("T"));
        var task = bus.subscribe("T", e -> { });
        assertTrue(bus.hasSubscribers("T"));
        assertFalse(bus.hasSubscribers("U"));
        task.unsubscribe();
        bus.subscribeAll(e -> { });
        assertTrue(bus.hasSubscribers("U"));
    }

    @Test
    @DisplayName("A throwing subscriber does not block the others")
    void throwingSubscriber() {
        List<String> received = new ArrayList<>();
        bus.subscribeAll(e -> { throw new IllegalStateException("boom"); });
        bus.subscribeAll(e -> received.add(e.eventType()));

        assertDoesNotThrow(() -> bus.publish(SentinelEvent.of("tier.completed", "T", Map.of("tier", 1))));
        assertEquals(List.of("tier.completed"), received);
    }
}
