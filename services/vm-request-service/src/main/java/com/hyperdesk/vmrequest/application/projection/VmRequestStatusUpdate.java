package com.hyperdesk.vmrequest.application.projection;

import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;

import java.time.Instant;

/**
 * Status change for a read-model row. Actor fields are {@code null} when they do not apply
 * and leave the stored value unchanged.
 */
public record VmRequestStatusUpdate(
        VmRequestId id,
        String tenantId,
        VmRequestStatus status,
        long version,
        String approvedBy,
        String approvedByName,
        String rejectedBy,
        String rejectedByName,
        String rejectionReason,
        Instant updatedAt) {

    public static VmRequestStatusUpdate status(VmRequestId id, String tenantId, VmRequestStatus status,
                                               long version, Instant updatedAt) {
        return new VmRequestStatusUpdate(id, tenantId, status, version, null, null, null, null, null, updatedAt);
    }

    public static VmRequestStatusUpdate approved(VmRequestId id, String tenantId, long version,
                                                 String approvedBy, String approvedByName, Instant updatedAt) {
        return new VmRequestStatusUpdate(id, tenantId, VmRequestStatus.APPROVED, version,
                approvedBy, approvedByName, null, null, null, updatedAt);
    }

    public static VmRequestStatusUpdate rejected(VmRequestId id, String tenantId, long version,
                                                 String rejectedBy, String rejectedByName, String reason,
                                                 Instant updatedAt) {
        return new VmRequestStatusUpdate(id, tenantId, VmRequestStatus.REJECTED, version,
                null, null, rejectedBy, rejectedByName, reason, updatedAt);
    }
}
