package com.sync.pipeline.analysis.workflow;

import com.sync.pipeline.alert.AlertCandidate;
import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityState;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutations queued by the nodes of one workflow run, flushed once by the {@link BatchFlusher}.
 *
 * <p>Immutable: nodes take a {@link Builder} from {@link #toBuilder()}, queue their changes
 * and return the built batch to the engine. Raising and resolving the same alert are
 * mutually exclusive; the later call wins. Tag additions and removals behave the same way.</p>
 */
public final class DeferredBatch {

    private static final DeferredBatch EMPTY = new Builder().build();

    private final Map<String, Set<String>> tagsAdded;
    private final Map<String, Set<String>> tagsRemoved;
    private final Map<String, EntityState> states;
    private final Map<String, AlertCandidate> alerts;
    private final Set<String> resolvedFingerprints;
    private final Set<String> evaluatedAlertTypes;

    private DeferredBatch(Builder builder) {
        this.tagsAdded = freeze(builder.tagsAdded);
        this.tagsRemoved = freeze(builder.tagsRemoved);
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(builder.states));
        this.alerts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.alerts));
        this.resolvedFingerprints = Collections.unmodifiableSet(new LinkedHashSet<>(builder.resolvedFingerprints));
        this.evaluatedAlertTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.evaluatedAlertTypes));
    }

    public static DeferredBatch empty() {
        return EMPTY;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Tags of the entity as they will be after the flush.
     */
    public Set<String> effectiveTags(Entity entity) {
        Set<String> added = tagsAdded.getOrDefault(entity.getId(), Set.of());
        Set<String> removed = tagsRemoved.getOrDefault(entity.getId(), Set.of());
        if (added.isEmpty() && removed.isEmpty()) {
            return entity.getTags();
        }
        Set<String> tags = new TreeSet<>(entity.getTags());
        tags.removeAll(removed);
        tags.addAll(added);
        return tags;
    }

    public boolean hasTag(Entity entity, String tag) {
        return effectiveTags(entity).contains(tag);
    }

    public Map<String, Set<String>> getTagsAdded() {
        return tagsAdded;
    }

    public Map<String, Set<String>> getTagsRemoved() {
        return tagsRemoved;
    }

    public Map<String, EntityState> getStates() {
        return states;
    }

    public Optional<EntityState> stateOf(String entityId) {
        return Optional.ofNullable(states.get(entityId));
    }

    public Collection<AlertCandidate> getAlerts() {
        return alerts.values();
    }

    public Optional<AlertCandidate> getAlert(String alertType, String entityId) {
        return Optional.ofNullable(alerts.get(AlertCandidate.fingerprint(alertType, entityId)));
    }

    public Set<String> getResolvedFingerprints() {
        return resolvedFingerprints;
    }

    public Set<String> getEvaluatedAlertTypes() {
        return evaluatedAlertTypes;
    }

    /**
     * Entities with a queued tag or state change.
     */
    public Set<String> getTouchedEntityIds() {
        Set<String> ids = new LinkedHashSet<>(tagsAdded.keySet());
        ids.addAll(tagsRemoved.keySet());
        ids.addAll(states.keySet());
        return ids;
    }

    /**
     * Number of queued mutations.
     */
    public int size() {
        return tagsAdded.values().stream().mapToInt(Set::size).sum()
                + tagsRemoved.values().stream().mapToInt(Set::size).sum()
                + states.size() + alerts.size() + resolvedFingerprints.size();
    }

    public boolean isEmpty() {
        return size() == 0 && evaluatedAlertTypes.isEmpty();
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((id, tags) -> {
            if (!tags.isEmpty()) {
                copy.put(id, Set.copyOf(tags));
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private final Map<String, Set<String>> tagsAdded = new HashMap<>();
        private final Map<String, Set<String>> tagsRemoved = new HashMap<>();
        private final Map<String, EntityState> states = new LinkedHashMap<>();
        private final Map<String, AlertCandidate> alerts = new LinkedHashMap<>();
        private final Set<String> resolvedFingerprints = new LinkedHashSet<>();
        private final Set<String> evaluatedAlertTypes = new LinkedHashSet<>();

        private Builder() {
        }

        private Builder(DeferredBatch batch) {
            batch.tagsAdded.forEach((id, tags) -> tagsAdded.put(id, new TreeSet<>(tags)));
            batch.tagsRemoved.forEach((id, tags) -> tagsRemoved.put(id, new TreeSet<>(tags)));
            states.putAll(batch.states);
            alerts.putAll(batch.alerts);
            resolvedFingerprints.addAll(batch.resolvedFingerprints);
            evaluatedAlertTypes.addAll(batch.evaluatedAlertTypes);
        }

        public Builder addTag(String entityId, String tag) {
            tagsAdded.computeIfAbsent(entityId, k -> new TreeSet<>()).add(tag);
            Optional.ofNullable(tagsRemoved.get(entityId)).ifPresent(tags -> tags.remove(tag));
            return this;
        }

        public Builder removeTag(String entityId, String tag) {
            tagsRemoved.computeIfAbsent(entityId, k -> new TreeSet<>()).add(tag);
            Optional.ofNullable(tagsAdded.get(entityId)).ifPresent(tags -> tags.remove(tag));
            return this;
        }

        public Builder setState(String entityId, EntityState state) {
            states.put(entityId, state);
            return this;
        }

        /**
         * Marks the rule type as evaluated, so its stored alerts not raised in this run are resolved.
         */
        public Builder evaluated(String alertType) {
            evaluatedAlertTypes.add(alertType);
            return this;
        }

        public Builder raise(AlertCandidate candidate) {
            alerts.put(candidate.fingerprint(), candidate);
            resolvedFingerprints.remove(candidate.fingerprint());
            evaluatedAlertTypes.add(candidate.alertType());
            return this;
        }

        public Builder resolve(String alertType, String entityId) {
            String fingerprint = AlertCandidate.fingerprint(alertType, entityId);
            alerts.remove(fingerprint);
            resolvedFingerprints.add(fingerprint);
            evaluatedAlertTypes.add(alertType);
            return this;
        }

        public DeferredBatch build() {
            return new DeferredBatch(this);
        }
    }
}
