package com.hyperdesk.vmrequest.application.provisioning;

import com.hyperdesk.vmrequest.application.hypervisor.HypervisorError;

/**
 * VM creation gave up.
 *
 * @param lastError error of the final attempt
 * @param attempts  attempts made, 1 when the error was not retriable
 */
public record ProvisioningFailure(HypervisorError lastError, int attempts) {

    public ProvisioningErrorCode errorCode() {
        return ProvisioningErrorCode.of(lastError);
    }
}
