package com.tariffwise.core.persistence;

import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.ThreadAttemptRecord;

import java.util.Collection;
import java.util.Optional;

/**
 * Store of {@link ThreadAttemptRecord}s, the only state shared between concurrent requests.
 * <p>
 * Implementations throw {@link AttemptStoreException} when the backing store fails.
 */
public interface AttemptRecordStore {

    Optional<ThreadAttemptRecord> get(String threadKey);

    /**
     * Atomically records one more attempt for {@code threadKey}.
     * <ul>
     *   <li>absent: create with {@code attempts=1}, allow attempt 1</li>
     *   <li>{@code attempts < maxAttempts}: increment, allow attempt {@code attempts+1}</li>
     *   <li>{@code attempts >= maxAttempts}: leave the counter unchanged, escalate with the prior codes</li>
     * </ul>
     * Racing calls for the same key never push the stored counter past {@code maxAttempts}.
     */
    AttemptStatus incrementOrCreate(String threadKey, int maxAttempts, String subject);

    /** Adds codes to the record's history, keeping it distinct and in first-seen order. No-op for unknown keys. */
    void recordCodes(String threadKey, Collection<String> codes);
}
