package com.sync.pipeline.store;

import com.sync.pipeline.tenant.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link DocumentStore}.
 * Suitable for testing and single-JVM deployments.
 *
 * <p>An optional unique-key extractor enforces a uniqueness constraint among
 * documents that are not soft-deleted.</p>
 */
public class InMemoryDocumentStore<T extends TenantDocument> implements DocumentStore<T> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final String table;
    private final Map<String, T> documents = new ConcurrentHashMap<>();
    private final Function<T, Object> uniqueKey;
    private final Map<Object, String> liveKeys = new ConcurrentHashMap<>();
    private final AtomicLong reads = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();

    public InMemoryDocumentStore(String table) {
        this(table, null);
    }

    public InMemoryDocumentStore(String table, Function<T, Object> uniqueKey) {
        this.table = Objects.requireNonNull(table, "table is required");
        this.uniqueKey = uniqueKey;
    }

    @Override
    public Optional<T> get(String tenantId, String id) {
        TenantContext.checkAccess(tenantId);
        reads.incrementAndGet();
        T document = documents.get(id);
        if (document == null || !tenantId.equals(document.getTenantId())) {
            return Optional.empty();
        }
        return Optional.of(document);
    }

    @Override
    public List<T> getMany(String tenantId, Collection<String> ids) {
        TenantContext.checkAccess(tenantId);
        reads.incrementAndGet();
        List<T> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            T document = documents.get(id);
            if (document != null && tenantId.equals(document.getTenantId())) {
                result.add(document);
            }
        }
        return result;
    }

    @Override
    public List<T> find(String tenantId, Predicate<? super T> filter) {
        TenantContext.checkAccess(tenantId);
        reads.incrementAndGet();
        return documents.values().stream()
                .filter(d -> tenantId.equals(d.getTenantId()))
                .filter(filter)
                .toList();
    }

    @Override
    public synchronized List<T> insert(List<T> batch) {
        checkBatchAccess(batch);
        writes.incrementAndGet();
        Set<Object> batchKeys = new HashSet<>();
        for (T document : batch) {
            if (uniqueKey != null && !isDeleted(document) && !batchKeys.add(uniqueKey.apply(document))) {
                throw new StorageException(table + ": unique key repeated in batch " + uniqueKey.apply(document));
            }
            if (documents.containsKey(document.getId())) {
                throw new StorageException(table + ": duplicate id " + document.getId());
            }
            if (uniqueKey != null && !isDeleted(document) && liveKeys.containsKey(uniqueKey.apply(document))) {
                throw new StorageException(table + ": unique key violation " + uniqueKey.apply(document));
            }
        }
        batch.forEach(this::store);
        log.debug("store.inserted table={} count={}", table, batch.size());
        return batch;
    }

    @Override
    public synchronized List<T> update(List<T> batch) {
        checkBatchAccess(batch);
        writes.incrementAndGet();
        for (T document : batch) {
            T existing = documents.get(document.getId());
            if (existing == null || !existing.getTenantId().equals(document.getTenantId())) {
                throw new StorageException(table + ": document not found " + document.getId());
            }
            if (uniqueKey != null && !isDeleted(document)) {
                String owner = liveKeys.get(uniqueKey.apply(document));
                if (owner != null && !owner.equals(document.getId())) {
                    throw new StorageException(table + ": unique key violation " + uniqueKey.apply(document));
                }
            }
        }
        batch.forEach(this::store);
        log.debug("store.updated table={} count={}", table, batch.size());
        return batch;
    }

    @Override
    @SuppressWarnings("unchecked")
    public synchronized int softDelete(String tenantId, Collection<String> ids, Instant deletedAt) {
        TenantContext.checkAccess(tenantId);
        writes.incrementAndGet();
        int marked = 0;
        for (String id : ids) {
            T document = documents.get(id);
            if (document == null || !tenantId.equals(document.getTenantId())) {
                continue;
            }
            if (!(document instanceof SoftDeletable<?> deletable)) {
                throw new UnsupportedOperationException(table + " documents cannot be soft-deleted");
            }
            if (!deletable.isDeleted()) {
                store((T) deletable.markDeleted(deletedAt));
                marked++;
            }
        }
        log.debug("store.softDeleted table={} count={}", table, marked);
        return marked;
    }

    @Override
    public long getReadCount() {
        return reads.get();
    }

    @Override
    public long getWriteCount() {
        return writes.get();
    }

    /**
     * Number of stored documents, including soft-deleted ones.
     */
    public int size() {
        return documents.size();
    }

    private void store(T document) {
        T previous = documents.put(document.getId(), document);
        if (uniqueKey == null) {
            return;
        }
        if (previous != null) {
            liveKeys.remove(uniqueKey.apply(previous), previous.getId());
        }
        if (!isDeleted(document)) {
            liveKeys.put(uniqueKey.apply(document), document.getId());
        }
    }

    private static boolean isDeleted(TenantDocument document) {
        return document instanceof SoftDeletable<?> s && s.isDeleted();
    }

    private void checkBatchAccess(List<T> batch) {
        for (T document : batch) {
            TenantContext.checkAccess(document.getTenantId());
        }
    }
}
