package com.sync.pipeline.store;

import java.time.Instant;

/**
 * Documents the pipeline retires by soft deletion rather than removal.
 *
 * @param <T> the concrete document type
 */
public interface SoftDeletable<T extends TenantDocument> {

    Instant getDeletedAt();

    default boolean isDeleted() {
        return getDeletedAt() != null;
    }

    /**
     * Returns a copy of this document marked deleted at the given instant.
     */
    T markDeleted(Instant deletedAt);
}
