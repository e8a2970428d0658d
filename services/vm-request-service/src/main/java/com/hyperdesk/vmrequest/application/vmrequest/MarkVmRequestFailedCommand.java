package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;

import java.time.Instant;

import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requirePresent;
import static com.hyperdesk.vmrequest.application.vmrequest.CommandPreconditions.requireText;

/** Records that provisioning gave up after {@code retryCount} attempts. */
public record MarkVmRequestFailedCommand(
        String tenantId,
        String userId,
        VmRequestId requestId,
        String errorCode,
        String reason,
        boolean retriable,
        int retryCount,
        Instant lastAttemptAt,
        String correlationId) {

    public MarkVmRequestFailedCommand {
        requireText(tenantId, "tenantId");
        requireText(userId, "userId");
        requirePresent(requestId, "requestId");
        requireText(errorCode, "errorCode");
        requireText(reason, "reason");
        requirePresent(lastAttemptAt, "lastAttemptAt");
        requireText(correlationId, "correlationId");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
    }
}
