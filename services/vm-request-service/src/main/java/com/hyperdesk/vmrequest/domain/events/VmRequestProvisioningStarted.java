package com.hyperdesk.vmrequest.domain.events;

import com.hyperdesk.eventstore.EventMetadata;

import java.util.UUID;

public record VmRequestProvisioningStarted(UUID requestId, EventMetadata metadata) implements VmRequestEvent {}
