package com.hyperdesk.tenant;

import java.util.Optional;

/**
 * Thread-bound tenant context for the outer boundary (message listeners, executor hand-offs).
 * <p>
 * Core code never reads this holder; commands carry the tenant id explicitly. The holder only
 * keeps the tenant of the current unit of work visible to the thread that runs it.
 */
public final class TenantContextHolder {

    private static final ThreadLocal<TenantContext> CONTEXT = new ThreadLocal<>();

    private TenantContextHolder() {
        // utility class
    }

    public static void set(TenantContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
    }

    public static Optional<TenantContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static void clear() {
        CONTEXT.remove();
    }
}
