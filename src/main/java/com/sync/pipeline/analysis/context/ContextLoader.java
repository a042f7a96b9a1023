package com.sync.pipeline.analysis.context;

import com.sync.pipeline.core.model.Entity;
import com.sync.pipeline.core.model.EntityType;
import com.sync.pipeline.core.model.Relationship;
import com.sync.pipeline.metrics.MetricsService;
import com.sync.pipeline.store.EntityRepository;
import com.sync.pipeline.store.RelationshipRepository;
import com.sync.pipeline.store.StorageException;
import com.sync.pipeline.tenant.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Loads an {@link AnalysisContext} with one bulk read per entity type plus one for
 * relationships, all issued in parallel. The number of reads depends only on the entity
 * types requested, never on how many entities exist.
 */
public class ContextLoader {
    private static final Logger log = LoggerFactory.getLogger(ContextLoader.class);

    private final EntityRepository entities;
    private final RelationshipRepository relationships;
    private final Executor executor;
    private final long slowQueryThresholdMs;
    private final long timeoutMs;
    private final MetricsService metricsService;

    public ContextLoader(EntityRepository entities, RelationshipRepository relationships, Executor executor,
                         long slowQueryThresholdMs, long timeoutMs, MetricsService metricsService) {
        this.entities = entities;
        this.relationships = relationships;
        this.executor = executor;
        this.slowQueryThresholdMs = slowQueryThresholdMs;
        this.timeoutMs = timeoutMs;
        this.metricsService = metricsService;
    }

    /**
     * Loads every entity type of the data source, excluding soft-deleted records.
     */
    public AnalysisContext load(String tenantId, String dataSourceId) {
        return load(tenantId, dataSourceId, EnumSet.allOf(EntityType.class), false);
    }

    /**
     * @throws StorageException when a read fails or the load exceeds its timeout
     */
    public AnalysisContext load(String tenantId, String dataSourceId, Set<EntityType> types, boolean includeDeleted) {
        long start = System.nanoTime();

        Map<EntityType, CompletableFuture<List<Entity>>> entityReads = new EnumMap<>(EntityType.class);
        for (EntityType type : types) {
            entityReads.put(type, read(tenantId, "entities:" + type.getWireName(),
                    () -> entities.findByDataSource(tenantId, dataSourceId, type, includeDeleted)));
        }
        CompletableFuture<List<Relationship>> relationshipRead = read(tenantId, "relationships",
                () -> relationships.findByDataSource(tenantId, dataSourceId, includeDeleted));
        int queryCount = entityReads.size() + 1;

        List<CompletableFuture<?>> all = new ArrayList<>(entityReads.values());
        all.add(relationshipRead);
        await(CompletableFuture.allOf(all.toArray(new CompletableFuture[0])), tenantId, dataSourceId);

        Map<EntityType, List<Entity>> loaded = new EnumMap<>(EntityType.class);
        int totalEntities = 0;
        for (Map.Entry<EntityType, CompletableFuture<List<Entity>>> entry : entityReads.entrySet()) {
            List<Entity> list = entry.getValue().join();
            loaded.put(entry.getKey(), list);
            totalEntities += list.size();
        }
        List<Relationship> loadedRelationships = relationshipRead.join();
        int totalRelationships = (int) loadedRelationships.stream().filter(r -> includeDeleted || !r.isDeleted()).count();

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        LoadStats stats = new LoadStats(queryCount, elapsed.toMillis(), totalEntities, totalRelationships);
        metricsService.recordContextLoad(elapsed, queryCount);
        log.info("context.loaded dataSourceId={} queries={} entities={} relationships={} durationMs={}",
                dataSourceId, queryCount, totalEntities, totalRelationships, elapsed.toMillis());
        return new AnalysisContext(tenantId, dataSourceId, loaded, loadedRelationships, stats);
    }

    private <T> CompletableFuture<T> read(String tenantId, String name, Supplier<T> query) {
        return CompletableFuture.supplyAsync(() -> {
            long start = System.nanoTime();
            try (TenantContext.TenantScope scope = TenantContext.scoped(tenantId)) {
                return query.get();
            } finally {
                long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                if (ms > slowQueryThresholdMs) {
                    log.warn("context.query.slow query={} durationMs={} thresholdMs={}", name, ms, slowQueryThresholdMs);
                }
            }
        }, executor);
    }

    private void await(CompletableFuture<Void> all, String tenantId, String dataSourceId) {
        try {
            all.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            all.cancel(true);
            throw new StorageException("Context load for " + tenantId + "/" + dataSourceId
                    + " timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while loading context for " + dataSourceId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause()
                    : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new StorageException("Context load failed for " + dataSourceId, cause);
        }
    }
}
