package com.tariffwise.core.model;

import java.io.Serializable;

/**
 * One change (or notable non-change) made by a gate, for the payload's audit trail.
 *
 * @param gate   gate name
 * @param target the item description or text element affected
 * @param action short action verb, e.g. "validated", "corrected", "flagged_invalid", "replaced_phrase"
 * @param detail human-readable explanation
 */
public record GateAuditEntry(
    String gate,
    String target,
    String action,
    String detail
) implements Serializable {}
