package com.hyperdesk.vmrequest.application.notification;

import com.hyperdesk.vmrequest.domain.EmailAddress;
import com.hyperdesk.vmrequest.domain.VmRequestId;

public record VmRequestApprovedNotification(
        VmRequestId requestId,
        String tenantId,
        EmailAddress requesterEmail,
        String vmName,
        String projectName,
        String approverName) {}
