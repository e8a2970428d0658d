package com.hyperdesk.vmrequest.application.hypervisor.mapping;

import com.hyperdesk.vmrequest.domain.VmName;
import com.hyperdesk.vmrequest.domain.VmSize;

/**
 * Tenant-level description of the VM to build.
 *
 * @param networkName tenant-visible network name, {@code null} for the tenant default
 */
public record ProvisioningRequest(String tenantId, VmName vmName, VmSize size, String networkName) {}
