package com.hyperdesk.vmrequest.domain.events;

import com.hyperdesk.eventstore.EventMetadata;

import java.util.UUID;

/**
 * An admin approved the request; {@code metadata.userId()} is the approver. Triggers provisioning.
 */
public record VmRequestApproved(
        UUID requestId,
        String vmName,
        UUID projectId,
        String requesterId,
        String requesterEmail,
        String approverName,
        EventMetadata metadata) implements VmRequestEvent {}
