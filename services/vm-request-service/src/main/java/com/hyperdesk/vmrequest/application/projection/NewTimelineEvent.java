package com.hyperdesk.vmrequest.application.projection;

import com.hyperdesk.eventstore.EventMetadata;
import com.hyperdesk.vmrequest.domain.VmRequestId;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * One human-readable history entry.
 *
 * @param id deterministic id derived from type, request and correlation id, so a re-delivered
 *           command writes the same entry instead of a duplicate
 */
public record NewTimelineEvent(
        UUID id,
        VmRequestId requestId,
        String tenantId,
        TimelineEventType eventType,
        String actorId,
        String actorName,
        String details,
        Instant occurredAt) {

    public static NewTimelineEvent of(TimelineEventType type, VmRequestId requestId, String actorName,
                                      String details, EventMetadata metadata) {
        String key = type.name() + ":" + requestId + ":" + metadata.correlationId();
        return new NewTimelineEvent(
                UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)),
                requestId,
                metadata.tenantId(),
                type,
                metadata.userId(),
                actorName,
                details,
                metadata.timestamp());
    }
}
