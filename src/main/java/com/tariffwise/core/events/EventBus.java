package com.tariffwise.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for classification results.
 * <p>
 * Supports per-request subscriptions and global subscriptions that receive all events.
 * A failing subscriber never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ClassificationEvent>>> requestSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ClassificationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(ClassificationEvent event) {
        log.debug("Publishing event: {} for request {}", event.eventType(), event.requestId());

        List<Consumer<ClassificationEvent>> subs = requestSubscribers.get(event.requestId());
        if (subs != null) {
            for (Consumer<ClassificationEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<ClassificationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String requestId, Consumer<ClassificationEvent> consumer) {
        requestSubscribers.computeIfAbsent(requestId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<ClassificationEvent>> subs = requestSubscribers.get(requestId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    requestSubscribers.remove(requestId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<ClassificationEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ClassificationEvent> subscriber, ClassificationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
