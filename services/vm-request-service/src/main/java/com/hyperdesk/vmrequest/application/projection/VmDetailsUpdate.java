package com.hyperdesk.vmrequest.application.projection;

import com.hyperdesk.vmrequest.domain.VmRequestId;

import java.time.Instant;

/** Runtime details of the provisioned (or failed) VM. Null fields leave the stored value as is. */
public record VmDetailsUpdate(
        VmRequestId id,
        String tenantId,
        String hypervisorVmId,
        String ipAddress,
        String hostname,
        Instant provisionedAt,
        String warningMessage,
        String errorMessage,
        String powerState,
        Instant lastSyncedAt) {

    public static VmDetailsUpdate ready(VmRequestId id, String tenantId, String hypervisorVmId, String ipAddress,
                                        String hostname, Instant provisionedAt, String warningMessage) {
        return new VmDetailsUpdate(id, tenantId, hypervisorVmId, ipAddress, hostname, provisionedAt,
                warningMessage, null, null, null);
    }

    public static VmDetailsUpdate failed(VmRequestId id, String tenantId, String errorMessage) {
        return new VmDetailsUpdate(id, tenantId, null, null, null, null, null, errorMessage, null, null);
    }

    /** Values read back from the hypervisor by a status sync. */
    public static VmDetailsUpdate synced(VmRequestId id, String tenantId, String hypervisorVmId, String ipAddress,
                                         String hostname, String powerState, Instant lastSyncedAt) {
        return new VmDetailsUpdate(id, tenantId, hypervisorVmId, ipAddress, hostname, null, null, null,
                powerState, lastSyncedAt);
    }
}
