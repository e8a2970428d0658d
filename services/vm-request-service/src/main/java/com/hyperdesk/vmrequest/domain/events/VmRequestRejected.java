package com.hyperdesk.vmrequest.domain.events;

import com.hyperdesk.eventstore.EventMetadata;

import java.util.UUID;

/** An admin rejected the request; {@code metadata.userId()} is the rejecting admin. */
public record VmRequestRejected(
        UUID requestId,
        String reason,
        String vmName,
        UUID projectId,
        String requesterId,
        String requesterEmail,
        String rejectorName,
        EventMetadata metadata) implements VmRequestEvent {

    public static final int MIN_REASON_LENGTH = 10;
    public static final int MAX_REASON_LENGTH = 500;
}
