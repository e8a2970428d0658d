package com.hyperdesk.vmrequest.domain.events;

import com.hyperdesk.eventstore.DomainEvent;

import java.util.UUID;

/**
 * Events of the VM request stream.
 *
 * <p>Payload fields are plain values (UUIDs, strings, enums, instants) so stored streams stay
 * readable when value-object classes change.
 */
public sealed interface VmRequestEvent extends DomainEvent
        permits VmRequestCreated, VmRequestCancelled, VmRequestApproved, VmRequestRejected,
        VmRequestProvisioningStarted, VmRequestReady, VmRequestProvisioningFailed {

    String AGGREGATE_TYPE = "VmRequest";

    UUID requestId();

    @Override
    default String aggregateType() {
        return AGGREGATE_TYPE;
    }
}
