package com.hyperdesk.vmrequest.application.projection;

import com.hyperdesk.vmrequest.domain.ProjectId;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import com.hyperdesk.vmrequest.domain.VmSize;

import java.time.Instant;

/** Initial read-model row for a VM request. */
public record NewVmRequestProjection(
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
        Instant createdAt,
        long version) {}
