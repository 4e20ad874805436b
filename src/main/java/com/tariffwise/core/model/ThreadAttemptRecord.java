package com.tariffwise.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Number of automated attempts made for one thread key, with the codes produced so far.
 * Records are kept after escalation.
 */
public record ThreadAttemptRecord(
    String threadKey,
    String subject,
    int attempts,
    List<String> priorCodes,
    Instant firstSeen,
    Instant lastSeen
) implements Serializable {

    public ThreadAttemptRecord {
        priorCodes = priorCodes == null ? List.of() : List.copyOf(priorCodes);
    }
}
