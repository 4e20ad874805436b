package com.tariffwise.core.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private final EventBus bus = new EventBus();

    private static ClassificationEvent event(String requestId) {
        return new ClassificationEvent(ClassificationEvent.COMPLETED, requestId, Map.of("status", "CLASSIFIED"), Instant.now());
    }

    @Test
    @DisplayName("request subscribers only see their own request; global subscribers see all")
    void routing() {
        List<String> forOne = new ArrayList<>();
        List<String> all = new ArrayList<>();
        bus.subscribe("CLS-1", e -> forOne.add(e.requestId()));
        bus.subscribeAll(e -> all.add(e.requestId()));

        bus.publish(event("CLS-1"));
        bus.publish(event("CLS-2"));

        assertEquals(List.of("CLS-1"), forOne);
        assertEquals(List.of("CLS-1", "CLS-2"), all);
    }

    @Test
    @DisplayName("unsubscribe stops delivery")
    void unsubscribe() {
        List<ClassificationEvent> received = new ArrayList<>();
        EventBus.Subscription subscription = bus.subscribe("CLS-1", received::add);

        subscription.unsubscribe();
        bus.publish(event("CLS-1"));

        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("a failing subscriber does not affect the others")
    void failingSubscriber() {
        List<ClassificationEvent> received = new ArrayList<>();
        bus.subscribeAll(e -> {
            throw new IllegalStateException("broken consumer");
        });
        bus.subscribeAll(received::add);

        assertDoesNotThrow(() -> bus.publish(event("CLS-1")));
        assertEquals(1, received.size());
    }
}
