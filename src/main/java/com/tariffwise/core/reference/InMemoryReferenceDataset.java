package com.tariffwise.core.reference;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reference dataset held in a sorted map, loaded from a JSON array of {@link ReferenceRecord}s.
 */
public class InMemoryReferenceDataset implements ReferenceDataset {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReferenceDataset.class);

    private final NavigableMap<String, ReferenceRecord> records = new TreeMap<>();

    public InMemoryReferenceDataset(Collection<ReferenceRecord> records) {
        for (ReferenceRecord record : records) {
            if (!record.code().isEmpty()) {
                this.records.put(record.code(), record);
            }
        }
    }

    public static InMemoryReferenceDataset load(InputStream json, ObjectMapper mapper) throws IOException {
        List<ReferenceRecord> loaded = mapper.readValue(json, new TypeReference<List<ReferenceRecord>>() {});
        log.info("Loaded {} reference record(s)", loaded.size());
        return new InMemoryReferenceDataset(loaded);
    }

    @Override
    public Optional<ReferenceRecord> lookupByCode(String code) {
        String normalized = TariffCodes.normalize(code);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(normalized));
    }

    @Override
    public List<ReferenceRecord> searchPrefix(String prefix) {
        String normalized = TariffCodes.normalize(prefix);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(records.subMap(normalized, true, normalized + Character.MAX_VALUE, false).values());
    }

    @Override
    public List<ReferenceRecord> searchDescription(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String[] keywords = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
        List<ReferenceRecord> matches = new ArrayList<>();
        for (ReferenceRecord record : records.values()) {
            String description = record.description().toLowerCase(Locale.ROOT);
            boolean all = true;
            for (String keyword : keywords) {
                if (!description.contains(keyword)) {
                    all = false;
                    break;
                }
            }
            if (all) {
                matches.add(record);
                if (matches.size() >= limit) {
                    break;
                }
            }
        }
        return matches;
    }

    @Override
    public int size() {
        return records.size();
    }
}
