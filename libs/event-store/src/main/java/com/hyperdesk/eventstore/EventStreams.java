package com.hyperdesk.eventstore;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Argument checks and envelope construction shared by the store implementations. */
final class EventStreams {

    static final int CURRENT_SCHEMA_VERSION = 1;

    private EventStreams() {
        // utility class
    }

    static void requireAppendable(UUID aggregateId, List<? extends DomainEvent> events, long expectedVersion) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId must not be null");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events must not be empty");
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion must not be negative: " + expectedVersion);
        }
    }

    static StoredEvent toStoredEvent(EventSerializer serializer, UUID aggregateId, DomainEvent event,
                                     long version, Instant storedAt) {
        return new StoredEvent(
                UUID.randomUUID(),
                aggregateId,
                event.aggregateType(),
                serializer.typeNameOf(event),
                CURRENT_SCHEMA_VERSION,
                version,
                event.metadata(),
                serializer.serialize(event),
                storedAt);
    }
}
