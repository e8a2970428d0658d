package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;

import java.util.List;

/**
 * Hands committed events to in-process subscribers such as the provisioning saga.
 * Called only after a successful append.
 */
@FunctionalInterface
public interface VmRequestEventPublisher {

    void publish(List<VmRequestEvent> committedEvents);

    static VmRequestEventPublisher noOp() {
        return events -> { };
    }
}
