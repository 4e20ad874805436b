package com.tariffwise.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of the loop-breaker check for one request.
 *
 * @param threadKey     hashed thread key; null when the request carried no subject or reference id
 * @param allowed       whether automated output may be released
 * @param escalate      whether the request must be routed to a human
 * @param attemptNumber 1-based number of this attempt for the thread
 * @param priorCodes    codes produced by earlier attempts on the same thread
 * @param evaluated     false when the attempt store could not be consulted (fail-open)
 */
public record AttemptStatus(
    @JsonProperty("thread_key") String threadKey,
    boolean allowed,
    boolean escalate,
    @JsonProperty("attempt_number") int attemptNumber,
    @JsonProperty("prior_codes") List<String> priorCodes,
    boolean evaluated
) implements Serializable {

    public AttemptStatus {
        priorCodes = priorCodes == null ? List.of() : List.copyOf(priorCodes);
    }

    public static AttemptStatus allowed(String threadKey, int attemptNumber, List<String> priorCodes) {
        return new AttemptStatus(threadKey, true, false, attemptNumber, priorCodes, true);
    }

    public static AttemptStatus escalation(String threadKey, int attemptNumber, List<String> priorCodes) {
        return new AttemptStatus(threadKey, false, true, attemptNumber, priorCodes, true);
    }

    /** Used when the attempt store is unavailable: allow, treat as a first attempt. */
    public static AttemptStatus failOpen(String threadKey) {
        return new AttemptStatus(threadKey, true, false, 1, List.of(), false);
    }
}
