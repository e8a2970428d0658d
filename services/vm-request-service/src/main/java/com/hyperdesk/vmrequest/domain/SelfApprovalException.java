package com.hyperdesk.vmrequest.domain;

/** An admin tried to approve or reject their own request. */
public class SelfApprovalException extends VmRequestDomainException {

    private final String adminId;
    private final String operation;

    public SelfApprovalException(String adminId, String operation) {
        super("Admin %s cannot %s their own request".formatted(adminId, operation));
        this.adminId = adminId;
        this.operation = operation;
    }

    public String getAdminId() {
        return adminId;
    }

    public String getOperation() {
        return operation;
    }
}
