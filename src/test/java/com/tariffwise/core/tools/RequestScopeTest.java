package com.tariffwise.core.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RequestScopeTest {

    @Test
    @DisplayName("cost ledger sums calls per provider")
    void costLedger() {
        RequestScope scope = RequestScope.of("CLS-1");

        scope.recordCost("gemini", 0.0004);
        scope.recordCost("claude", 0.003);
        scope.recordCost("gemini", 0.0006);
        scope.recordCost("gemini", 0.0);

        assertEquals(0.004, scope.totalCostUsd(), 1e-9);
        Map<String, Double> byProvider = scope.costByProvider();
        assertEquals(2, byProvider.size());
        assertEquals(0.001, byProvider.get("gemini"), 1e-9);
        assertEquals(0.003, byProvider.get("claude"), 1e-9);
    }

    @Test
    @DisplayName("a fresh scope has an empty ledger and cache")
    void freshScope() {
        RequestScope scope = RequestScope.of("CLS-2");

        assertEquals(0.0, scope.totalCostUsd());
        assertTrue(scope.costByProvider().isEmpty());
        assertEquals(0, scope.cacheSize());
        assertTrue(scope.deadline().isEmpty());
    }

    @Test
    @DisplayName("cached values are computed once per scope")
    void cachedOnce() {
        RequestScope scope = RequestScope.of("CLS-3");
        AtomicInteger loads = new AtomicInteger();

        scope.cached("verify:8516710000", loads::incrementAndGet);
        scope.cached("verify:8516710000", loads::incrementAndGet);

        assertEquals(1, loads.get());
    }
}
