package com.tariffwise.core.model;

import java.util.Locale;

/**
 * Confidence tiers attached to a candidate classification.
 */
public enum Confidence {
    HIGH, MEDIUM, LOW;

    /** One tier lower; LOW stays LOW. */
    public Confidence downgrade() {
        return switch (this) {
            case HIGH -> MEDIUM;
            case MEDIUM, LOW -> LOW;
        };
    }

    /**
     * Maps a free-text label (English or Hebrew) to a tier. Unknown labels map to LOW.
     */
    public static Confidence fromText(String label) {
        if (label == null || label.isBlank()) {
            return LOW;
        }
        String normalized = label.strip().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "high", "very high", "גבוהה", "גבוה" -> HIGH;
            case "medium", "moderate", "בינונית", "בינוני" -> MEDIUM;
            default -> LOW;
        };
    }

    public static Confidence fromScore(double score) {
        if (score >= 0.85) return HIGH;
        if (score >= 0.6) return MEDIUM;
        return LOW;
    }
}
