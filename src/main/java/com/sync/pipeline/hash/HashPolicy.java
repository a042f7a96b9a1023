package com.sync.pipeline.hash;

import com.sync.pipeline.core.model.EntityType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Versioned deny list of fields excluded from the content hash.
 *
 * <p>Fields are matched by name at any nesting depth. The version is part of every hash,
 * so changing the list requires a new version and invalidates stored hashes explicitly
 * rather than silently.</p>
 *
 * @param version       policy version, mixed into the hash
 * @param globalFields  fields stripped for every entity type
 * @param fieldsByType  additional fields stripped per entity type
 */
public record HashPolicy(String version, Set<String> globalFields, Map<EntityType, Set<String>> fieldsByType) {

    public HashPolicy {
        Objects.requireNonNull(version, "version is required");
        globalFields = globalFields != null ? Set.copyOf(globalFields) : Set.of();
        Map<EntityType, Set<String>> copy = new EnumMap<>(EntityType.class);
        if (fieldsByType != null) {
            fieldsByType.forEach((type, fields) -> copy.put(type, Set.copyOf(fields)));
        }
        fieldsByType = Collections.unmodifiableMap(copy);
    }

    /**
     * Every field stripped for the given entity type, sorted.
     */
    public Set<String> volatileFields(EntityType entityType) {
        Set<String> fields = new TreeSet<>(globalFields);
        fields.addAll(fieldsByType.getOrDefault(entityType, Set.of()));
        return Collections.unmodifiableSet(fields);
    }
}
