package com.sync.pipeline.store;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Narrow contract to the external document store. Every operation is scoped by tenant.
 *
 * @param <T> document type of one table
 */
public interface DocumentStore<T extends TenantDocument> {

    /**
     * Gets one document by id, empty if absent or owned by another tenant.
     */
    Optional<T> get(String tenantId, String id);

    /**
     * Gets many documents by id in a single read.
     */
    List<T> getMany(String tenantId, Collection<String> ids);

    /**
     * Returns every document of the tenant accepted by the filter, in a single read.
     */
    List<T> find(String tenantId, Predicate<? super T> filter);

    /**
     * Inserts a batch of new documents.
     *
     * @throws StorageException if an id or unique key already exists
     */
    List<T> insert(List<T> documents);

    /**
     * Replaces a batch of existing documents, matched by id.
     *
     * @throws StorageException if a document does not exist
     */
    List<T> update(List<T> documents);

    /**
     * Marks a batch of documents deleted.
     *
     * @return the number of documents newly marked
     */
    int softDelete(String tenantId, Collection<String> ids, Instant deletedAt);

    /**
     * Number of read operations issued so far (one per call, regardless of rows returned).
     */
    long getReadCount();

    /**
     * Number of write operations issued so far.
     */
    long getWriteCount();
}
