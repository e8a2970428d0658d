package com.hyperdesk.vmrequest.application.projection;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.domain.VmRequestId;

import java.util.Optional;

/** Read side needed to refresh a provisioned VM's runtime state. */
public interface VmStatusProjectionQuery {

    /**
     * Looks up the hypervisor's id of the VM built for a request.
     *
     * @return empty when the row exists but no VM has been provisioned yet;
     *         {@link ProjectionError.NotFound} when the tenant has no such row
     */
    Result<Optional<String>, ProjectionError> findHypervisorVmId(String tenantId, VmRequestId id);
}
