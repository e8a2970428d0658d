package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.application.hypervisor.VmPowerState;
import com.hyperdesk.vmrequest.domain.VmRequestId;

/** State written by a successful sync. {@code ipAddress} is null while the guest has none. */
public record SyncVmStatusResult(VmRequestId requestId, VmPowerState powerState, String ipAddress) {}
