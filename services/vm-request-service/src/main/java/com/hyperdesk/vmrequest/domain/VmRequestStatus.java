package com.hyperdesk.vmrequest.domain;

/** Lifecycle states of a VM request. */
public enum VmRequestStatus {
    PENDING,
    APPROVED,
    REJECTED,
    CANCELLED,
    PROVISIONING,
    READY,
    FAILED;

    /** Terminal states accept no further domain transitions, only idempotent repeats. */
    public boolean isTerminal() {
        return this == REJECTED || this == CANCELLED || this == READY || this == FAILED;
    }

    public boolean canBeActedOnByAdmin() {
        return this == PENDING;
    }
}
