package com.hyperdesk.vmrequest.application.notification;

import com.hyperdesk.vmrequest.domain.EmailAddress;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmSize;

public record VmRequestCreatedNotification(
        VmRequestId requestId,
        String tenantId,
        EmailAddress requesterEmail,
        String vmName,
        String projectName,
        VmSize size) {}
