package com.tariffwise.core.tools;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * State that lives for exactly one classification request and is passed explicitly to
 * every tool invocation. Nothing here is shared between requests.
 */
public final class RequestScope {

    private final String requestId;
    private final Instant startedAt;
    private final Instant deadline;
    private final Map<String, Object> cache = new ConcurrentHashMap<>();
    private final Map<String, Double> costByProvider = new ConcurrentHashMap<>();

    public RequestScope(String requestId, Instant startedAt, Instant deadline) {
        this.requestId = requestId;
        this.startedAt = startedAt;
        this.deadline = deadline;
    }

    public static RequestScope of(String requestId) {
        return new RequestScope(requestId, Instant.now(), null);
    }

    public String requestId() {
        return requestId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /** The caller's own deadline, if it has one. */
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Returns the cached value for {@code key}, computing it on first use within this request.
     */
    @SuppressWarnings("unchecked")
    public <T> T cached(String key, Supplier<T> loader) {
        Object value = cache.get(key);
        if (value == null) {
            value = loader.get();
            if (value != null) {
                cache.put(key, value);
            }
        }
        return (T) value;
    }

    public int cacheSize() {
        return cache.size();
    }

    /** Adds one provider call's cost to this request's ledger. */
    public void recordCost(String provider, double costUsd) {
        if (costUsd > 0) {
            costByProvider.merge(provider, costUsd, Double::sum);
        }
    }

    public double totalCostUsd() {
        return costByProvider.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public Map<String, Double> costByProvider() {
        return new TreeMap<>(costByProvider);
    }
}
