package com.waypoint.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for transition lifecycle events.
 * <p>
 * Supports per-work-unit subscriptions and global subscriptions that receive all events.
 * A subscriber that throws is logged and skipped; it never disturbs the transition.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<WaypointEvent>>> unitSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<WaypointEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(WaypointEvent event) {
        log.debug("Publishing event: {} for {}", event.eventType(), event.workUnitId());

        List<Consumer<WaypointEvent>> unitSubs = unitSubscribers.get(event.workUnitId());
        if (unitSubs != null) {
            for (Consumer<WaypointEvent> subscriber : unitSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<WaypointEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one work unit.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String workUnitId, Consumer<WaypointEvent> consumer) {
        unitSubscribers.computeIfAbsent(workUnitId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<WaypointEvent>> subs = unitSubscribers.get(workUnitId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<WaypointEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<WaypointEvent> subscriber, WaypointEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
