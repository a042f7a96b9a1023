package com.sync.pipeline.lock;

import java.util.function.Supplier;

/**
 * Lock guarding a load-diff-write cycle against concurrent replays of the same scope.
 */
public interface DistributedLock {

    /**
     * Acquires the lock on the given key, waiting up to the configured timeout.
     *
     * @param key the lock key, e.g. {@code tenant:integration:dataSource:entityType}
     * @return true once acquired
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String key);

    void unlock(String key);

    /**
     * Joins key segments with {@code :}, e.g. {@code key("alert", tenantId, alertId)}.
     *
     * @throws IllegalArgumentException if a segment is null or blank
     */
    static String key(String... segments) {
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                throw new IllegalArgumentException("Lock key segments must not be blank");
            }
        }
        return String.join(":", segments);
    }

    /**
     * Runs the action while holding the lock on {@code key}.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
