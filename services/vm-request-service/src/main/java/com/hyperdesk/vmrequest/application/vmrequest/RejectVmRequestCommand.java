package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.events.VmRequestRejected;

import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requirePresent;
import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requireText;

/**
 * An admin rejects a pending request.
 *
 * @param expectedVersion version the admin saw; {@code null} skips the check
 */
public record RejectVmRequestCommand(
        String tenantId,
        String adminId,
        String adminName,
        VmRequestId requestId,
        String reason,
        Long expectedVersion,
        String correlationId) {

    public RejectVmRequestCommand {
        requireText(tenantId, "tenantId");
        requireText(adminId, "adminId");
        requirePresent(requestId, "requestId");
        requireText(correlationId, "correlationId");
        if (reason == null
                || reason.trim().length() < VmRequestRejected.MIN_REASON_LENGTH
                || reason.length() > VmRequestRejected.MAX_REASON_LENGTH) {
            throw new IllegalArgumentException("reason must be between " + VmRequestRejected.MIN_REASON_LENGTH
                    + " and " + VmRequestRejected.MAX_REASON_LENGTH + " characters");
        }
    }
}
