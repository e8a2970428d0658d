package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;

import java.time.Instant;

import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requirePresent;
import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requireText;

/** Records the VM the hypervisor created for a provisioning request. */
public record MarkVmRequestReadyCommand(
        String tenantId,
        String userId,
        VmRequestId requestId,
        String hypervisorVmId,
        String ipAddress,
        String hostname,
        Instant provisionedAt,
        String warningMessage,
        String correlationId) {

    public MarkVmRequestReadyCommand {
        requireText(tenantId, "tenantId");
        requireText(userId, "userId");
        requirePresent(requestId, "requestId");
        requireText(hypervisorVmId, "hypervisorVmId");
        requireText(hostname, "hostname");
        requirePresent(provisionedAt, "provisionedAt");
        requireText(correlationId, "correlationId");
    }
}
