package com.sync.pipeline.analysis.context;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * {@code entityId -> related entity ids} for one relationship type and direction.
 */
public final class RelationshipMap {

    private final Map<String, Set<String>> related = new HashMap<>();
    private int edgeCount;

    void add(String from, String to) {
        if (related.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to)) {
            edgeCount++;
        }
    }

    /**
     * Related ids, empty when there are none.
     */
    public Set<String> get(String entityId) {
        Set<String> ids = related.get(entityId);
        return ids != null ? Collections.unmodifiableSet(ids) : Set.of();
    }

    public boolean contains(String from, String to) {
        Set<String> ids = related.get(from);
        return ids != null && ids.contains(to);
    }

    public int keyCount() {
        return related.size();
    }

    public int edgeCount() {
        return edgeCount;
    }
}
