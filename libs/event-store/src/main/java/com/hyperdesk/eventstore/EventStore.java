package com.hyperdesk.eventstore;

import java.util.List;
import java.util.UUID;

/**
 * Append-only, per-aggregate event streams with optimistic concurrency.
 *
 * <p>The store only persists. Projections, notifications and publishing are the caller's
 * responsibility, after a successful append.
 */
public interface EventStore {

    /**
     * Appends events atomically at positions {@code expectedVersion .. expectedVersion + n - 1}.
     *
     * @param aggregateId     target stream
     * @param events          non-empty, ordered events
     * @param expectedVersion stream length the caller observed
     * @return the new stream length, or a {@link ConcurrencyConflict} if the stream moved
     * @throws IllegalArgumentException if {@code events} is empty or {@code expectedVersion} is negative
     * @throws EventStoreException      on storage failure
     */
    Result<Long, ConcurrencyConflict> append(UUID aggregateId, List<? extends DomainEvent> events,
                                             long expectedVersion);

    /**
     * Loads a whole stream ordered by version.
     *
     * @return the events, or an empty list if nothing was ever appended for {@code aggregateId}
     * @throws EventStoreException on storage failure
     */
    List<StoredEvent> load(UUID aggregateId);

    /**
     * Returns the current stream length (0 for an unknown aggregate).
     *
     * @throws EventStoreException on storage failure
     */
    long currentVersion(UUID aggregateId);
}
