package com.hyperdesk.vmrequest.domain.events;

import com.hyperdesk.eventstore.EventMetadata;
import com.hyperdesk.vmrequest.domain.VmSize;

import java.util.UUID;

/**
 * A user submitted a VM request. First event of every stream.
 *
 * <p>Display names are denormalized here so the read model can be rebuilt from the stream alone.
 */
public record VmRequestCreated(
        UUID requestId,
        UUID projectId,
        String projectName,
        String requesterId,
        String requesterName,
        String vmName,
        VmSize size,
        String justification,
        String requesterEmail,
        EventMetadata metadata) implements VmRequestEvent {}
