package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;

/** Why a VM status sync did not update the read model. */
public sealed interface SyncVmStatusError {

    String message();

    /** No read-model row for the caller's tenant. */
    record NotFound(VmRequestId requestId) implements SyncVmStatusError {
        @Override
        public String message() {
            return "VM request not found: " + requestId;
        }
    }

    /** The request has no VM on the hypervisor yet. */
    record NotProvisioned(VmRequestId requestId) implements SyncVmStatusError {
        @Override
        public String message() {
            return "VM has not been provisioned yet";
        }
    }

    record HypervisorError(String message) implements SyncVmStatusError {}

    /** The read model could not be read or written. */
    record UpdateFailure(String message) implements SyncVmStatusError {}
}
