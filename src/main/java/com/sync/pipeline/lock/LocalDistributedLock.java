package com.sync.pipeline.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock for single-JVM deployments.
 *
 * <p>Keys are fine grained (one per sync scope, one per alert), so an entry lives only
 * while some thread holds or waits for its key and is dropped on the last release.
 * Entry bookkeeping happens inside {@link ConcurrentHashMap#compute}, which serializes
 * it per key.</p>
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        KeyLock entry = locks.compute(key, (k, existing) -> {
            KeyLock held = existing != null ? existing : new KeyLock();
            held.users++;
            return held;
        });
        boolean acquired;
        try {
            acquired = entry.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            release(key, entry);
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for lock '" + key + "'", e);
        }
        if (!acquired) {
            release(key, entry);
            log.warn("lock.timeout key={} timeoutMs={}", key, config.timeoutMs());
            throw new LockAcquisitionException(
                    "Lock '" + key + "' still held by another worker after " + config.timeoutMs() + "ms");
        }
        if (entry.lock.getHoldCount() == 1) {
            log.debug("lock.acquired key={}", key);
        }
        return true;
    }

    @Override
    public void unlock(String key) {
        KeyLock entry = locks.get(key);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            log.debug("lock.release.ignored key={} reason=not-held", key);
            return;
        }
        entry.lock.unlock();
        release(key, entry);
        if (!entry.lock.isHeldByCurrentThread()) {
            log.debug("lock.released key={}", key);
        }
    }

    /**
     * Whether any thread currently holds {@code key}.
     */
    public boolean isLocked(String key) {
        KeyLock entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    /**
     * Number of keys currently held or awaited.
     */
    public int activeKeys() {
        return locks.size();
    }

    private void release(String key, KeyLock entry) {
        locks.computeIfPresent(key, (k, current) -> {
            if (current != entry) {
                return current;
            }
            current.users--;
            return current.users == 0 ? null : current;
        });
    }

    /**
     * Counts holds (reentrant ones included) plus waiters; only mutated under the map's per-key compute.
     */
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
