package com.tariffwise.core.persistence;

import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.ThreadAttemptRecord;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attempt store for a single process; not durable across restarts.
 * Atomicity comes from {@link ConcurrentHashMap#compute}.
 */
public class InMemoryAttemptRecordStore implements AttemptRecordStore {

    private final ConcurrentHashMap<String, ThreadAttemptRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryAttemptRecordStore() {
        this(Clock.systemUTC());
    }

    public InMemoryAttemptRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<ThreadAttemptRecord> get(String threadKey) {
        return Optional.ofNullable(records.get(threadKey));
    }

    @Override
    public AttemptStatus incrementOrCreate(String threadKey, int maxAttempts, String subject) {
        AttemptStatus[] outcome = new AttemptStatus[1];
        records.compute(threadKey, (key, existing) -> {
            Instant now = clock.instant();
            if (existing == null) {
                outcome[0] = AttemptStatus.allowed(key, 1, List.of());
                return new ThreadAttemptRecord(key, subject, 1, List.of(), now, now);
            }
            if (existing.attempts() < maxAttempts) {
                int next = existing.attempts() + 1;
                outcome[0] = AttemptStatus.allowed(key, next, existing.priorCodes());
                return new ThreadAttemptRecord(key, existing.subject(), next, existing.priorCodes(),
                        existing.firstSeen(), now);
            }
            outcome[0] = AttemptStatus.escalation(key, existing.attempts() + 1, existing.priorCodes());
            return new ThreadAttemptRecord(key, existing.subject(), existing.attempts(), existing.priorCodes(),
                    existing.firstSeen(), now);
        });
        return outcome[0];
    }

    @Override
    public void recordCodes(String threadKey, Collection<String> codes) {
        records.computeIfPresent(threadKey, (key, existing) -> {
            var merged = new LinkedHashSet<>(existing.priorCodes());
            merged.addAll(codes);
            return new ThreadAttemptRecord(key, existing.subject(), existing.attempts(), new ArrayList<>(merged),
                    existing.firstSeen(), existing.lastSeen());
        });
    }
}
