package com.hyperdesk.vmrequest.infrastructure.persistence;

import com.hyperdesk.vmrequest.application.projection.TimelineEventType;

import java.time.Instant;
import java.util.UUID;

/** Stored timeline entry as read back. */
public record TimelineEntry(
        UUID id,
        TimelineEventType eventType,
        String actorId,
        String actorName,
        String details,
        Instant occurredAt) {}
