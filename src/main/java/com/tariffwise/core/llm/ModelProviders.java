package com.tariffwise.core.llm;

import java.util.Objects;

/**
 * The primary (cost-optimized) provider and an optional secondary fallback.
 */
public record ModelProviders(ModelClient primary, ModelClient secondary) {

    public ModelProviders {
        Objects.requireNonNull(primary, "primary provider must not be null");
    }

    public boolean hasSecondary() {
        return secondary != null;
    }
}
