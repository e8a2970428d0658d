package com.hyperdesk.tenant;

/**
 * Tenant ownership checks for loaded resources.
 * <p>
 * A resource owned by another tenant must look exactly like a missing resource to the caller,
 * so callers map a mismatch to their own "not found" result rather than a distinct error.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Returns {@code true} when the resource belongs to the requesting tenant.
     *
     * @param requestingTenantId tenant the caller acts for
     * @param resourceTenantId   tenant recorded on the resource
     */
    public static boolean belongsTo(String requestingTenantId, String resourceTenantId) {
        if (requestingTenantId == null || resourceTenantId == null) {
            return false;
        }
        return requestingTenantId.equals(resourceTenantId);
    }
}
