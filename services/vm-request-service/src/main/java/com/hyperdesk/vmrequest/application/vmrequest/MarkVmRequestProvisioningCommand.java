package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;

import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requirePresent;
import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requireText;

/** Moves an approved request into provisioning. Issued by the provisioning flow. */
public record MarkVmRequestProvisioningCommand(
        String tenantId,
        String userId,
        VmRequestId requestId,
        String correlationId) {

    public MarkVmRequestProvisioningCommand {
        requireText(tenantId, "tenantId");
        requireText(userId, "userId");
        requirePresent(requestId, "requestId");
        requireText(correlationId, "correlationId");
    }
}
