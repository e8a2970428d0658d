package com.hyperdesk.vmrequest.infrastructure.persistence;

import com.hyperdesk.vmrequest.domain.ProjectId;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import com.hyperdesk.vmrequest.domain.VmSize;

import java.time.Instant;

/** One row of {@code vm_request_projections} as read back. */
public record VmRequestProjectionRow(
        VmRequestId id,
        String tenantId,
        String requesterId,
        String requesterName,
        ProjectId projectId,
        String projectName,
        String vmName,
        VmSize size,
        String justification,
        VmRequestStatus status,
        String approvedBy,
        String approvedByName,
        String rejectedBy,
        String rejectedByName,
        String rejectionReason,
        String hypervisorVmId,
        String ipAddress,
        String hostname,
        Instant provisionedAt,
        String warningMessage,
        String errorMessage,
        String powerState,
        Instant lastSyncedAt,
        Instant createdAt,
        Instant updatedAt,
        long version) {}
