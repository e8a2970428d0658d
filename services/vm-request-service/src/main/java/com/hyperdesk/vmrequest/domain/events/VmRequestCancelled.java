package com.hyperdesk.vmrequest.domain.events;

import com.hyperdesk.eventstore.EventMetadata;

import java.util.UUID;

/** The requester withdrew a pending request. {@code reason} is optional. */
public record VmRequestCancelled(UUID requestId, String reason, EventMetadata metadata) implements VmRequestEvent {

    public static final int MAX_REASON_LENGTH = 500;
}
