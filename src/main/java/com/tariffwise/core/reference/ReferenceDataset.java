package com.tariffwise.core.reference;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the tariff reference dataset.
 * <p>
 * Codes passed in may contain separators; implementations normalize them.
 */
public interface ReferenceDataset {

    Optional<ReferenceRecord> lookupByCode(String code);

    /** All records whose normalized code starts with {@code prefix}, ordered by code. */
    List<ReferenceRecord> searchPrefix(String prefix);

    /** Records whose description contains every keyword of {@code query}, at most {@code limit}. */
    List<ReferenceRecord> searchDescription(String query, int limit);

    int size();
}
