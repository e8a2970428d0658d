package com.hyperdesk.vmrequest.application.provisioning;

import com.hyperdesk.vmrequest.application.hypervisor.HypervisorError;

/** User-facing classification of a provisioning failure, stored on the failure event. */
public enum ProvisioningErrorCode {
    INSUFFICIENT_RESOURCES("Cluster capacity reached. Please try a smaller size or contact support."),
    CONNECTION_FAILED("The virtualization platform could not be reached. IT has been notified."),
    CONNECTION_TIMEOUT("The virtualization platform did not respond in time. Please try again later."),
    TEMPLATE_NOT_FOUND("VM template missing. IT has been notified."),
    VM_CONFIG_INVALID("Invalid configuration. Please check your request parameters."),
    PERMISSION_DENIED("The platform refused the operation. IT has been notified."),
    OPERATION_NOT_SUPPORTED("This operation is not available on the selected platform."),
    NAME_CONFLICT("A VM with this name already exists. Please choose another name."),
    UNKNOWN("Unexpected error. IT has been notified.");

    private final String userMessage;

    ProvisioningErrorCode(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }

    public static ProvisioningErrorCode of(HypervisorError error) {
        if (error instanceof HypervisorError.ResourceExhausted) {
            return INSUFFICIENT_RESOURCES;
        } else if (error instanceof HypervisorError.ConnectionFailed) {
            return CONNECTION_FAILED;
        } else if (error instanceof HypervisorError.OperationTimeout) {
            return CONNECTION_TIMEOUT;
        } else if (error instanceof HypervisorError.ResourceNotFound notFound) {
            return "template".equalsIgnoreCase(notFound.resourceType()) ? TEMPLATE_NOT_FOUND : UNKNOWN;
        } else if (error instanceof HypervisorError.InvalidVmSpec
                || error instanceof HypervisorError.InvalidConfiguration) {
            return VM_CONFIG_INVALID;
        } else if (error instanceof HypervisorError.AuthenticationFailed
                || error instanceof HypervisorError.AuthorizationFailed) {
            return PERMISSION_DENIED;
        } else if (error instanceof HypervisorError.OperationNotSupported) {
            return OPERATION_NOT_SUPPORTED;
        } else if (error instanceof HypervisorError.ResourceAlreadyExists) {
            return NAME_CONFLICT;
        }
        return UNKNOWN;
    }
}
