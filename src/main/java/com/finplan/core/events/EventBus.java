package com.finplan.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for projection events.
 * <p>
 * Supports per-scenario subscriptions and global subscriptions that receive all events.
 * Thread-safe, so scenarios projected in parallel may share one bus.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<FinplanEvent>>> scenarioSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<FinplanEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Delivers the event to the scenario's subscribers, then to global subscribers.
     * A throwing subscriber is logged and does not stop delivery to the others.
     */
    public void publish(FinplanEvent event) {
        log.debug("Publishing event: {} for scenario {}", event.eventType(), event.scenarioId());

        List<Consumer<FinplanEvent>> subs = scenarioSubscribers.get(event.scenarioId());
        if (subs != null) {
            for (Consumer<FinplanEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<FinplanEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * @param scenarioId the scenario to subscribe to
     * @param consumer   callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String scenarioId, Consumer<FinplanEvent> consumer) {
        scenarioSubscribers.computeIfAbsent(scenarioId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            var subs = scenarioSubscribers.get(scenarioId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    scenarioSubscribers.remove(scenarioId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<FinplanEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<FinplanEvent> subscriber, FinplanEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
