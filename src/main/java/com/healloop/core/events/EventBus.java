package com.healloop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for execution lifecycle events.
 * <p>
 * Supports per-execution subscriptions and global subscriptions that receive all events.
 * A failing subscriber never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<HealloopEvent>>> executionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<HealloopEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(HealloopEvent event) {
        log.debug("Publishing event: {} for execution {}", event.eventType(), event.executionId());

        List<Consumer<HealloopEvent>> subs = executionSubscribers.get(event.executionId());
        if (subs != null) {
            for (Consumer<HealloopEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<HealloopEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one execution.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String executionId, Consumer<HealloopEvent> consumer) {
        executionSubscribers.computeIfAbsent(executionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<HealloopEvent>> subs = executionSubscribers.get(executionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    executionSubscribers.remove(executionId, subs);
                }
            }
        };
    }

    /** Subscribe to events from all executions. */
    public Subscription subscribeAll(Consumer<HealloopEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<HealloopEvent> subscriber, HealloopEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
