package com.tariffwise.core.model;

/**
 * Overall status of a final payload.
 */
public enum PayloadStatus {
    /** All candidates valid, no warnings. */
    CLASSIFIED,
    /** Output released but degraded: corrections, invalid codes, low confidence or a degraded model run. */
    CLASSIFIED_WITH_WARNINGS,
    /** Loop breaker triggered; automated output withheld, route to a human. */
    ESCALATION_REQUIRED,
    /** No candidate could be produced; route to the manual path. */
    NO_CLASSIFICATION
}
