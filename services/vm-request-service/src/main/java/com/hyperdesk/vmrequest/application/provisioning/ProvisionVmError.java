package com.hyperdesk.vmrequest.application.provisioning;

import com.hyperdesk.vmrequest.application.hypervisor.HypervisorError;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.MappingError;
import com.hyperdesk.vmrequest.application.vmrequest.VmRequestError;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;

/** Why a provisioning run did not produce a ready VM. */
public sealed interface ProvisionVmError {

    /** Another delivery already moved the request past {@code APPROVED}; nothing was done. */
    record AlreadyInProgress(VmRequestId requestId, VmRequestStatus currentState) implements ProvisionVmError {}

    /** Loading or updating the request itself failed. */
    record RequestFailed(VmRequestError cause) implements ProvisionVmError {}

    /** The tenant's resource mapping could not produce a VM spec. The request is marked failed. */
    record MappingFailed(MappingError cause) implements ProvisionVmError {}

    /**
     * The hypervisor refused or failed. The request is marked failed.
     *
     * @param attempts create calls made before giving up
     */
    record HypervisorFailed(HypervisorError error, int attempts) implements ProvisionVmError {

        public boolean retriable() {
            return error.retriable();
        }
    }
}
