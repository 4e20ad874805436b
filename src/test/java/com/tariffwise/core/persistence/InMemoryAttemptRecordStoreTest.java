package com.tariffwise.core.persistence;

import com.tariffwise.core.model.AttemptStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAttemptRecordStoreTest {

    private final InMemoryAttemptRecordStore store = new InMemoryAttemptRecordStore();

    @Test
    @DisplayName("counter stops at the maximum and escalation carries prior codes")
    void escalationAfterMax() {
        store.incrementOrCreate("k", 2, "subject");
        store.recordCodes("k", List.of("8471300000"));
        store.incrementOrCreate("k", 2, "subject");

        AttemptStatus status = store.incrementOrCreate("k", 2, "subject");

        assertTrue(status.escalate());
        assertEquals(List.of("8471300000"), status.priorCodes());
        assertEquals(2, store.get("k").orElseThrow().attempts());
    }

    @Test
    @DisplayName("recorded codes stay distinct in first-seen order")
    void codesAreDistinct() {
        store.incrementOrCreate("k", 2, "subject");
        store.recordCodes("k", List.of("b", "a"));
        store.recordCodes("k", List.of("a", "c"));

        assertEquals(List.of("b", "a", "c"), store.get("k").orElseThrow().priorCodes());
    }

    @Test
    @DisplayName("concurrent increments allow exactly maxAttempts")
    void concurrentIncrements() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger allowed = new AtomicInteger();
        for (int i = 0; i < 50; i++) {
            pool.submit(() -> {
                start.await();
                if (store.incrementOrCreate("race", 3, "Race").allowed()) {
                    allowed.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(3, allowed.get());
        assertEquals(3, store.get("race").orElseThrow().attempts());
    }
}
