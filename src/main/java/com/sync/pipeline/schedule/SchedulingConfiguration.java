package com.sync.pipeline.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sync.pipeline.core.model.EntityType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static table of the entity types each integration supports and how often each is synced.
 */
public final class SchedulingConfiguration {

    public static final String DEFAULT_RESOURCE = "scheduling-config.json";

    private final Map<String, List<EntitySchedule>> integrations;

    @JsonCreator
    public SchedulingConfiguration(@JsonProperty("integrations") Map<String, List<EntitySchedule>> integrations) {
        Map<String, List<EntitySchedule>> copy = new LinkedHashMap<>();
        if (integrations != null) {
            integrations.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        }
        this.integrations = Collections.unmodifiableMap(copy);
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath.
     */
    public static SchedulingConfiguration load() {
        return load(DEFAULT_RESOURCE);
    }

    public static SchedulingConfiguration load(String resource) {
        ClassLoader loader = SchedulingConfiguration.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Scheduling configuration not found on classpath: " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read scheduling configuration " + resource, e);
        }
    }

    public static SchedulingConfiguration load(InputStream in) throws IOException {
        return new ObjectMapper().readValue(in, SchedulingConfiguration.class);
    }

    @JsonProperty("integrations")
    public Map<String, List<EntitySchedule>> getIntegrations() {
        return integrations;
    }

    public Set<String> integrationTypes() {
        return integrations.keySet();
    }

    /**
     * Schedules of an integration, empty for an unknown integration.
     */
    public List<EntitySchedule> forIntegration(String integrationType) {
        return integrations.getOrDefault(integrationType, List.of());
    }

    public Optional<EntitySchedule> find(String integrationType, EntityType entityType) {
        return forIntegration(integrationType).stream()
                .filter(schedule -> schedule.type() == entityType)
                .findFirst();
    }

    public boolean supports(String integrationType, EntityType entityType) {
        return find(integrationType, entityType).isPresent();
    }
}
