package com.tariffwise.core.memory;

import java.util.Optional;

/**
 * Store of previously confirmed classifications, keyed by normalized description.
 */
public interface ClassificationMemory {

    Optional<MemoryHit> lookup(String description);

    void remember(String description, String code, String referenceDescription, double confidence);

    int size();

    /** Memory key: lower-cased, whitespace-collapsed, first 50 characters. */
    static String keyOf(String description) {
        if (description == null) {
            return "";
        }
        String collapsed = description.strip().toLowerCase(java.util.Locale.ROOT).replaceAll("\\s+", " ");
        return collapsed.length() > 50 ? collapsed.substring(0, 50) : collapsed;
    }
}
