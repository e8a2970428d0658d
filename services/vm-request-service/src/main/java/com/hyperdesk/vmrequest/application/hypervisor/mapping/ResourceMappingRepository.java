package com.hyperdesk.vmrequest.application.hypervisor.mapping;

import java.util.Optional;

public interface ResourceMappingRepository {

    Optional<TenantResourceMapping> findByTenant(String tenantId);
}
