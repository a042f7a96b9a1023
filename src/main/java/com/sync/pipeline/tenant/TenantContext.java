package com.sync.pipeline.tenant;

import java.util.concurrent.Callable;

/**
 * Thread-bound tenant identity for the pipeline.
 *
 * <p>Stage handlers bind the tenant of the envelope they are processing; the document
 * store refuses reads and writes for any other tenant while one is bound.</p>
 *
 * <pre>
 * try (var scope = TenantContext.scoped(envelope.getTenantId())) {
 *     normalizeStage.handle(envelope);
 * }
 * </pre>
 *
 * <p>Executor-managed threads do not inherit the binding; wrap submitted work with
 * {@link #propagate(Runnable)} or {@link #propagate(Callable)}.</p>
 */
public final class TenantContext {

    private static final InheritableThreadLocal<String> currentTenant = new InheritableThreadLocal<>();

    private TenantContext() {
    }

    /**
     * Binds the tenant to this thread.
     *
     * @throws IllegalArgumentException if the id is null or blank
     */
    public static void setTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        currentTenant.set(tenantId);
    }

    /**
     * @return the bound tenant, or null if none
     */
    public static String getTenant() {
        return currentTenant.get();
    }

    public static boolean hasTenant() {
        return currentTenant.get() != null;
    }

    /**
     * Fails if a tenant is bound to this thread and differs from {@code tenantId}.
     *
     * @throws IllegalStateException on a cross-tenant access
     */
    public static void checkAccess(String tenantId) {
        String bound = currentTenant.get();
        if (bound != null && !bound.equals(tenantId)) {
            throw new IllegalStateException(
                    "Cross-tenant access denied: bound tenant " + bound + ", requested " + tenantId);
        }
    }

    public static void clear() {
        currentTenant.remove();
    }

    /**
     * Binds the tenant until the returned scope is closed, restoring any previous binding.
     */
    public static TenantScope scoped(String tenantId) {
        String previous = getTenant();
        setTenant(tenantId);
        return new TenantScope(previous);
    }

    /**
     * Captures the current tenant and returns a {@link Runnable} that restores it on the executing thread.
     */
    public static Runnable propagate(Runnable task) {
        String captured = getTenant();
        return () -> {
            String previous = getTenant();
            if (captured != null) {
                setTenant(captured);
            }
            try {
                task.run();
            } finally {
                restore(previous);
            }
        };
    }

    /**
     * Captures the current tenant and returns a {@link Callable} that restores it on the executing thread.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        String captured = getTenant();
        return () -> {
            String previous = getTenant();
            if (captured != null) {
                setTenant(captured);
            }
            try {
                return task.call();
            } finally {
                restore(previous);
            }
        };
    }

    private static void restore(String previous) {
        if (previous != null) {
            setTenant(previous);
        } else {
            clear();
        }
    }

    /**
     * AutoCloseable that restores the previous binding on close.
     */
    public static final class TenantScope implements AutoCloseable {

        private final String previous;

        private TenantScope(String previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            restore(previous);
        }
    }
}
