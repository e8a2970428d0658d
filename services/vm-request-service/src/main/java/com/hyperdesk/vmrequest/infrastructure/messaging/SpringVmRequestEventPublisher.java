package com.hyperdesk.vmrequest.infrastructure.messaging;

import com.hyperdesk.vmrequest.application.vmrequest.VmRequestEventPublisher;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

/** Publishes committed events as Spring application events, one per event, in stream order. */
public class SpringVmRequestEventPublisher implements VmRequestEventPublisher {

    private final ApplicationEventPublisher publisher;

    public SpringVmRequestEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publish(List<VmRequestEvent> committedEvents) {
        committedEvents.forEach(publisher::publishEvent);
    }
}
