package com.hyperdesk.eventstore;

import java.util.UUID;

/**
 * Storage-level failure while reading or writing an event stream.
 *
 * <p>Never used for optimistic-concurrency conflicts; those are returned as
 * {@link ConcurrencyConflict} values.
 */
public class EventStoreException extends RuntimeException {

    private final UUID aggregateId;

    public EventStoreException(UUID aggregateId, String message, Throwable cause) {
        super(message + " (aggregateId=" + aggregateId + ")", cause);
        this.aggregateId = aggregateId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }
}
