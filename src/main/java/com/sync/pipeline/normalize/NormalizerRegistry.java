package com.sync.pipeline.normalize;

import com.sync.pipeline.core.model.EntityType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Normalizers by integration type and entity type.
 */
public class NormalizerRegistry {

    private final Map<Key, Normalizer> normalizers = new ConcurrentHashMap<>();

    public NormalizerRegistry register(Normalizer normalizer) {
        normalizers.put(new Key(normalizer.integrationType(), normalizer.entityType()), normalizer);
        return this;
    }

    public NormalizerRegistry registerAll(List<? extends Normalizer> list) {
        list.forEach(this::register);
        return this;
    }

    public Optional<Normalizer> find(String integrationType, EntityType entityType) {
        return Optional.ofNullable(normalizers.get(new Key(integrationType, entityType)));
    }

    /**
     * Entity types with at least one registered normalizer.
     */
    public Set<EntityType> entityTypes() {
        return normalizers.keySet().stream().map(Key::entityType).collect(Collectors.toUnmodifiableSet());
    }

    private record Key(String integrationType, EntityType entityType) {
    }
}
