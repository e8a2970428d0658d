package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;

import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requirePresent;
import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requireText;

/**
 * An admin approves a pending request.
 *
 * @param expectedVersion version the admin saw; {@code null} skips the check
 */
public record ApproveVmRequestCommand(
        String tenantId,
        String adminId,
        String adminName,
        VmRequestId requestId,
        Long expectedVersion,
        String correlationId) {

    public ApproveVmRequestCommand {
        requireText(tenantId, "tenantId");
        requireText(adminId, "adminId");
        requirePresent(requestId, "requestId");
        requireText(correlationId, "correlationId");
    }
}
