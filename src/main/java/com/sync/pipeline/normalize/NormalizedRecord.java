package com.sync.pipeline.normalize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Canonical form of one vendor record.
 *
 * @param normalizedData canonical fields
 * @param tags           tags derived from the raw data alone; see {@link Normalizer#managedTags()}
 */
public record NormalizedRecord(Map<String, Object> normalizedData, Set<String> tags) {

    public NormalizedRecord {
        normalizedData = normalizedData != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(normalizedData))
                : Map.of();
        tags = tags != null ? Set.copyOf(tags) : Set.of();
    }

    public static NormalizedRecord of(Map<String, Object> normalizedData) {
        return new NormalizedRecord(normalizedData, Set.of());
    }
}
