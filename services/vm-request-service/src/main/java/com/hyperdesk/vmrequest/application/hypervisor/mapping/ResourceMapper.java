package com.hyperdesk.vmrequest.application.hypervisor.mapping;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorVmSpec;

/** Turns a tenant's provisioning request into a backend-native VM spec. */
public class ResourceMapper {

    public Result<HypervisorVmSpec, MappingError> toVmSpec(ProvisioningRequest request,
                                                           TenantResourceMapping mapping) {
        String networkName = request.networkName() != null ? request.networkName() : mapping.defaultNetwork();
        String networkId = networkName == null ? null : mapping.networks().get(networkName);
        if (networkId == null) {
            return Result.failure(new MappingError.UnknownNetwork(request.tenantId(), networkName));
        }
        String name = request.vmName().value();
        return Result.success(new HypervisorVmSpec(
                name,
                name,
                mapping.template(),
                request.size().cpuCores(),
                request.size().memoryGb(),
                request.size().diskGb(),
                mapping.computeTarget(),
                mapping.datastore(),
                networkId));
    }
}
