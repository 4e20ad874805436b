package com.tariffwise.core.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Classification memory held in a concurrent map.
 * <p>
 * Exact hits match the normalized key. When there is no exact hit, the entry with the highest
 * token overlap above the partial threshold is returned as a {@link MatchLevel#PARTIAL} hit with
 * its confidence discounted by {@link #PARTIAL_FACTOR}.
 */
public class InMemoryClassificationMemory implements ClassificationMemory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryClassificationMemory.class);

    static final double PARTIAL_FACTOR = 0.75;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final double partialThreshold;

    public InMemoryClassificationMemory(double partialThreshold) {
        this.partialThreshold = partialThreshold;
    }

    /** Seed entry as stored in the JSON resource. */
    public record Entry(
        String description,
        String code,
        @JsonProperty("reference_description") String referenceDescription,
        double confidence
    ) {}

    public void seed(InputStream json, ObjectMapper mapper) throws IOException {
        List<Entry> seed = mapper.readValue(json, new TypeReference<List<Entry>>() {});
        for (Entry entry : seed) {
            remember(entry.description(), entry.code(), entry.referenceDescription(), entry.confidence());
        }
        log.info("Classification memory seeded with {} entr{}", seed.size(), seed.size() == 1 ? "y" : "ies");
    }

    @Override
    public Optional<MemoryHit> lookup(String description) {
        String key = ClassificationMemory.keyOf(description);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        Entry exact = entries.get(key);
        if (exact != null) {
            return Optional.of(new MemoryHit(key, description, exact.code(), exact.referenceDescription(),
                    exact.confidence(), MatchLevel.EXACT));
        }

        Set<String> tokens = tokens(key);
        String bestKey = null;
        double bestScore = 0;
        for (var e : entries.entrySet()) {
            double score = jaccard(tokens, tokens(e.getKey()));
            if (score > bestScore) {
                bestScore = score;
                bestKey = e.getKey();
            }
        }
        if (bestKey == null || bestScore < partialThreshold) {
            return Optional.empty();
        }
        Entry partial = entries.get(bestKey);
        return Optional.of(new MemoryHit(bestKey, description, partial.code(), partial.referenceDescription(),
                partial.confidence() * PARTIAL_FACTOR, MatchLevel.PARTIAL));
    }

    @Override
    public void remember(String description, String code, String referenceDescription, double confidence) {
        String key = ClassificationMemory.keyOf(description);
        if (key.isEmpty() || code == null || code.isBlank()) {
            return;
        }
        entries.put(key, new Entry(description, code, referenceDescription, confidence));
    }

    @Override
    public int size() {
        return entries.size();
    }

    private static Set<String> tokens(String text) {
        return Arrays.stream(text.split("[^\\p{L}\\p{N}]+"))
                .filter(t -> t.length() > 1)
                .collect(Collectors.toCollection(HashSet::new));
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }
}
