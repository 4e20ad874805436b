package com.tariffwise.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted when a classification request finishes, consumed by delivery and
 * knowledge persistence.
 *
 * @param eventType event type ("classification.completed", "classification.escalated", "classification.failed")
 * @param requestId the request this event belongs to
 * @param payload   summary data for the event
 * @param timestamp when the event occurred
 */
public record ClassificationEvent(
    String eventType,
    String requestId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String COMPLETED = "classification.completed";
    public static final String ESCALATED = "classification.escalated";
    public static final String FAILED = "classification.failed";
}
