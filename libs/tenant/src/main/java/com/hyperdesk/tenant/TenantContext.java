package com.hyperdesk.tenant;

/**
 * Tenant identity for one operation.
 *
 * <p>Commands, projection writes and event metadata carry the tenant id explicitly; this record is
 * how the boundary hands it over.
 *
 * @param tenantId   unique tenant identifier (from the token's {@code tenant_id} claim)
 * @param tenantName optional display name
 */
public record TenantContext(String tenantId, String tenantName) {

    public TenantContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
    }

    public static TenantContext of(String tenantId) {
        return new TenantContext(tenantId, null);
    }
}
