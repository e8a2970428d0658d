package com.hyperdesk.eventstore;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata carried by every domain event.
 *
 * @param tenantId      owning tenant; streams never mix tenants
 * @param userId        acting user, or a system principal for saga-driven transitions
 * @param correlationId business flow the event belongs to
 * @param timestamp     wall-clock time the event was produced
 */
public record EventMetadata(String tenantId, String userId, String correlationId, Instant timestamp) {

    public EventMetadata {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /** Creates metadata stamped with the current time. */
    public static EventMetadata create(String tenantId, String userId, String correlationId) {
        return new EventMetadata(tenantId, userId, correlationId, Instant.now());
    }
}
