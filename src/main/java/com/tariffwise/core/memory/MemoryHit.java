package com.tariffwise.core.memory;

/**
 * A classification remembered for a description seen before.
 *
 * @param key                  normalized memory key of the stored description
 * @param itemDescription      description the hit was looked up for
 * @param code                 remembered code
 * @param referenceDescription reference description stored with the code; nullable
 * @param confidence           stored confidence, 0..1
 * @param level                exact or partial key match
 */
public record MemoryHit(
    String key,
    String itemDescription,
    String code,
    String referenceDescription,
    double confidence,
    MatchLevel level
) {

    /** True when the hit is strong enough to bypass the model for its line. */
    public boolean isShortcut(double threshold) {
        return level == MatchLevel.EXACT && confidence >= threshold && code != null && !code.isBlank();
    }
}
