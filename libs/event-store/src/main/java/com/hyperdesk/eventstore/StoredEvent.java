package com.hyperdesk.eventstore;

import java.time.Instant;
import java.util.UUID;

/**
 * An event as persisted in a stream.
 *
 * @param eventId       unique id of this event instance
 * @param aggregateId   stream the event belongs to
 * @param aggregateType logical aggregate type, e.g. {@code "VmRequest"}
 * @param eventType     registered event type name
 * @param schemaVersion payload schema version, starts at 1
 * @param version       0-based position in the stream
 * @param metadata      tenant, actor, correlation and timestamp
 * @param payload       JSON payload
 * @param storedAt      when the store accepted the event
 */
public record StoredEvent(
        UUID eventId,
        UUID aggregateId,
        String aggregateType,
        String eventType,
        int schemaVersion,
        long version,
        EventMetadata metadata,
        String payload,
        Instant storedAt) {}
