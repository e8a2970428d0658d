package com.hyperdesk.eventstore;

import java.util.UUID;

/**
 * Another writer advanced the stream since the caller loaded it.
 *
 * @param aggregateId     the contended stream
 * @param expectedVersion stream length the caller based its decision on
 * @param actualVersion   stream length found at write time
 */
public record ConcurrencyConflict(UUID aggregateId, long expectedVersion, long actualVersion) {}
