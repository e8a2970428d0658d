package com.hyperdesk.vmrequest.application.projection;

/** Kinds of entries shown on a request's history timeline. */
public enum TimelineEventType {
    CREATED,
    CANCELLED,
    APPROVED,
    REJECTED,
    PROVISIONING_STARTED,
    VM_READY,
    PROVISIONING_FAILED
}
