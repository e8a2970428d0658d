package com.hyperdesk.vmrequest.application.provisioning;

import com.hyperdesk.vmrequest.domain.ProjectId;
import com.hyperdesk.vmrequest.domain.VmName;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmSize;

import java.util.Objects;

/**
 * Builds the VM for an approved request. Derived from the request's event stream by the saga.
 *
 * @param networkName tenant network to attach, {@code null} for the tenant default
 */
public record ProvisionVmCommand(
        String tenantId,
        VmRequestId requestId,
        ProjectId projectId,
        String requesterId,
        VmName vmName,
        VmSize size,
        String networkName,
        String correlationId) {

    public ProvisionVmCommand {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(vmName, "vmName must not be null");
        Objects.requireNonNull(size, "size must not be null");
        Objects.requireNonNull(correlationId, "correlationId must not be null");
    }
}
