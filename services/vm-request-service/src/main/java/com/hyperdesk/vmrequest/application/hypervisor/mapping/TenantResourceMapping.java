package com.hyperdesk.vmrequest.application.hypervisor.mapping;

import java.util.Map;

/**
 * Where a tenant's VMs land on the backend.
 *
 * @param networks       tenant-visible network name to backend network id
 * @param defaultNetwork network name used when a request names none
 */
public record TenantResourceMapping(
        String tenantId,
        String computeTarget,
        String datastore,
        String template,
        Map<String, String> networks,
        String defaultNetwork) {

    public TenantResourceMapping {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        networks = networks == null ? Map.of() : Map.copyOf(networks);
    }
}
