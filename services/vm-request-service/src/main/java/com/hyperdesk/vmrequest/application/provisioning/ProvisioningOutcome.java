package com.hyperdesk.vmrequest.application.provisioning;

import com.hyperdesk.vmrequest.application.hypervisor.ProvisioningResult;
import com.hyperdesk.vmrequest.domain.VmRequestId;

/** A request whose VM was created and recorded as ready. */
public record ProvisioningOutcome(VmRequestId requestId, ProvisioningResult vm, long version) {}
