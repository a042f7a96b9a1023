package com.sync.pipeline.link;

import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Declares that a field of one entity type holds external ids of another entity type,
 * and which relationship that implies.
 *
 * @param holderType       type of the entity carrying the field
 * @param field            normalized-data field holding a list of external ids
 * @param otherType        type of the referenced entities
 * @param relationshipType relationship created per reference
 * @param holderIsSource   true for {@code holder -> other}, false for {@code other -> holder}
 * @param ignoredValues    placeholder values that reference nothing, e.g. {@code All}
 */
public record LinkRule(EntityType holderType, String field, EntityType otherType, String relationshipType,
                       boolean holderIsSource, Set<String> ignoredValues) {

    public LinkRule {
        Objects.requireNonNull(holderType, "holderType is required");
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(otherType, "otherType is required");
        Objects.requireNonNull(relationshipType, "relationshipType is required");
        ignoredValues = ignoredValues != null ? Set.copyOf(ignoredValues) : Set.of();
    }

    /**
     * {@code holder -> referenced}.
     */
    public static LinkRule outgoing(EntityType holderType, String field, EntityType targetType,
                                    String relationshipType) {
        return new LinkRule(holderType, field, targetType, relationshipType, true, Set.of());
    }

    /**
     * {@code referenced -> holder}.
     */
    public static LinkRule incoming(EntityType holderType, String field, EntityType sourceType,
                                    String relationshipType) {
        return new LinkRule(holderType, field, sourceType, relationshipType, false, Set.of());
    }

    public LinkRule ignoring(String... values) {
        return new LinkRule(holderType, field, otherType, relationshipType, holderIsSource,
                Set.copyOf(Arrays.asList(values)));
    }

    /**
     * External ids referenced by the holder, without placeholders.
     */
    public List<String> references(Entity holder) {
        Object value = holder.getNormalizedData().get(field);
        List<String> refs = new ArrayList<>();
        if (value instanceof Iterable<?> values) {
            for (Object ref : values) {
                if (ref != null && !ignoredValues.contains(ref.toString())) {
                    refs.add(ref.toString());
                }
            }
        }
        return refs;
    }

    public EntityType sourceType() {
        return holderIsSource ? holderType : otherType;
    }

    public EntityType targetType() {
        return holderIsSource ? otherType : holderType;
    }
}
