package com.hyperdesk.vmrequest.domain.events;

import com.hyperdesk.eventstore.EventMetadata;

import java.time.Instant;
import java.util.UUID;

/**
 * Provisioning gave up.
 *
 * @param errorCode     stable code for the failure category
 * @param reason        user-facing explanation
 * @param retriable     whether a later attempt could succeed
 * @param retryCount    attempts made before giving up
 * @param lastAttemptAt time of the final attempt
 */
public record VmRequestProvisioningFailed(
        UUID requestId,
        String errorCode,
        String reason,
        boolean retriable,
        int retryCount,
        Instant lastAttemptAt,
        EventMetadata metadata) implements VmRequestEvent {}
