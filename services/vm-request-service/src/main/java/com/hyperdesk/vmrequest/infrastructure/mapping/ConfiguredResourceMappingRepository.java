package com.hyperdesk.vmrequest.infrastructure.mapping;

import com.hyperdesk.vmrequest.application.hypervisor.mapping.ResourceMappingRepository;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.TenantResourceMapping;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Tenant resource mappings fixed at startup from configuration. */
public class ConfiguredResourceMappingRepository implements ResourceMappingRepository {

    private final Map<String, TenantResourceMapping> byTenant;

    public ConfiguredResourceMappingRepository(Collection<TenantResourceMapping> mappings) {
        this.byTenant = mappings.stream()
                .collect(Collectors.toUnmodifiableMap(TenantResourceMapping::tenantId, Function.identity()));
    }

    @Override
    public Optional<TenantResourceMapping> findByTenant(String tenantId) {
        return Optional.ofNullable(tenantId).map(byTenant::get);
    }

    public int size() {
        return byTenant.size();
    }
}
