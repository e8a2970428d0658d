package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.events.VmRequestCancelled;

import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requireMaxLength;
import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requirePresent;
import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requireText;

/** The requester withdraws a pending request. {@code reason} is optional. */
public record CancelVmRequestCommand(
        String tenantId,
        String userId,
        VmRequestId requestId,
        String reason,
        String correlationId) {

    public CancelVmRequestCommand {
        requireText(tenantId, "tenantId");
        requireText(userId, "userId");
        requirePresent(requestId, "requestId");
        requireText(correlationId, "correlationId");
        requireMaxLength(reason, VmRequestCancelled.MAX_REASON_LENGTH, "reason");
    }
}
