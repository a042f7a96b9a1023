package com.sync.pipeline.store;

/**
 * A record persisted in a {@link DocumentStore}. Every document belongs to exactly one tenant.
 */
public interface TenantDocument {

    String getId();

    String getTenantId();
}
