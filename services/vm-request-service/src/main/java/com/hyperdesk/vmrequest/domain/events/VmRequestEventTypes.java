package com.hyperdesk.vmrequest.domain.events;

import com.hyperdesk.eventstore.EventTypeRegistry;

/** Stored type names of the VM request events. Names are persisted; never rename them. */
public final class VmRequestEventTypes {

    public static final EventTypeRegistry REGISTRY = EventTypeRegistry.builder()
            .register("VmRequestCreated", VmRequestCreated.class)
            .register("VmRequestCancelled", VmRequestCancelled.class)
            .register("VmRequestApproved", VmRequestApproved.class)
            .register("VmRequestRejected", VmRequestRejected.class)
            .register("VmRequestProvisioningStarted", VmRequestProvisioningStarted.class)
            .register("VmRequestReady", VmRequestReady.class)
            .register("VmRequestProvisioningFailed", VmRequestProvisioningFailed.class)
            .build();

    private VmRequestEventTypes() {
        // utility class
    }
}
