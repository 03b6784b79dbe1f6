package com.sentinel.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for Sentinel run events.
 * <p>
 * Supports per-task subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-task subscribers keyed by Sentinel task id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SentinelEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all runs. */
    private final CopyOnWriteArrayList<Consumer<SentinelEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (task-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(SentinelEvent event) {
        log.debug("Publishing event: {} for {}", event.eventType(), event.taskId());

        List<Consumer<SentinelEvent>> taskSubs = taskSubscribers.get(event.taskId());
        if (taskSubs != null) {
            for (Consumer<SentinelEvent> subscriber : taskSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<SentinelEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific Sentinel task.
     *
     * @param taskId   the Sentinel task to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<SentinelEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        // one entry per Sentinel task would otherwise outlive every finished run
        return () -> taskSubscribers.computeIfPresent(taskId, (id, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Whether anyone is listening to {@code taskId}, directly or through a global subscription.
     */
    public boolean hasSubscribers(String taskId) {
        return !globalSubscribers.isEmpty() || taskSubscribers.containsKey(taskId);
    }

    public Subscription subscribeAll(Consumer<SentinelEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SentinelEvent> subscriber, SentinelEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
