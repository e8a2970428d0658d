package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.ProjectId;
import com.hyperdesk.vmrequest.domain.VmName;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.VmSize;

import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requirePresent;
import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requireText;

/**
 * Submit a new VM request.
 *
 * @param requesterEmail raw address from the identity token; may be missing or malformed, in which
 *                       case no notification is sent
 */
public record CreateVmRequestCommand(
        String tenantId,
        String requesterId,
        String requesterName,
        String requesterEmail,
        ProjectId projectId,
        String projectName,
        VmName vmName,
        VmSize size,
        String justification,
        String correlationId) {

    public CreateVmRequestCommand {
        requireText(tenantId, "tenantId");
        requireText(requesterId, "requesterId");
        requirePresent(projectId, "projectId");
        requirePresent(vmName, "vmName");
        requirePresent(size, "size");
        requireText(correlationId, "correlationId");
        if (justification == null || justification.trim().length() < VmRequestAggregate.MIN_JUSTIFICATION_LENGTH) {
            throw new IllegalArgumentException("justification must be at least "
                    + VmRequestAggregate.MIN_JUSTIFICATION_LENGTH + " characters");
        }
    }
}
