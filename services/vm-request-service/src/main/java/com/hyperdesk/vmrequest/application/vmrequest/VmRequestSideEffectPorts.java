package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.application.notification.VmRequestNotificationSender;
import com.hyperdesk.vmrequest.application.projection.TimelineEventProjectionUpdater;
import com.hyperdesk.vmrequest.application.projection.VmRequestProjectionUpdater;

import java.util.Objects;

/** Outbound ports the handlers touch after a successful append. */
public record VmRequestSideEffectPorts(
        VmRequestProjectionUpdater projections,
        TimelineEventProjectionUpdater timeline,
        VmRequestNotificationSender notifications,
        VmRequestEventPublisher publisher) {

    public VmRequestSideEffectPorts {
        Objects.requireNonNull(projections, "projections must not be null");
        Objects.requireNonNull(timeline, "timeline must not be null");
        Objects.requireNonNull(notifications, "notifications must not be null");
        Objects.requireNonNull(publisher, "publisher must not be null");
    }
}
