package com.tariffwise.core.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tariffwise.memory")
public class MemoryProperties {

    /** Minimum confidence for an exact hit to bypass the model. */
    private double hitThreshold = 0.9;

    /** Minimum token overlap (Jaccard) for a partial hit. */
    private double partialThreshold = 0.6;

    /** Optional JSON seed; empty disables seeding. */
    private String seedResource = "classpath:memory/seed.json";

    public double getHitThreshold() {
        return hitThreshold;
    }

    public void setHitThreshold(double hitThreshold) {
        this.hitThreshold = hitThreshold;
    }

    public double getPartialThreshold() {
        return partialThreshold;
    }

    public void setPartialThreshold(double partialThreshold) {
        this.partialThreshold = partialThreshold;
    }

    public String getSeedResource() {
        return seedResource;
    }

    public void setSeedResource(String seedResource) {
        this.seedResource = seedResource;
    }
}
