package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;

import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requirePresent;
import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requireText;

/** Refreshes the read model with the VM's current state on the hypervisor. */
public record SyncVmStatusCommand(
        String tenantId,
        String userId,
        VmRequestId requestId,
        String correlationId) {

    public SyncVmStatusCommand {
        requireText(tenantId, "tenantId");
        requireText(userId, "userId");
        requirePresent(requestId, "requestId");
        requireText(correlationId, "correlationId");
    }
}
