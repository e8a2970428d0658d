package com.hyperdesk.eventstore;

/**
 * An immutable fact recorded in an aggregate's event stream.
 *
 * <p>Implementations are records. Their components are serialized as the event payload, so they
 * must only hold JSON-friendly values (primitives, strings, enums, {@code Instant}s and records
 * of those).
 */
public interface DomainEvent {

    /** Who did this, for which tenant, within which business flow, and when. */
    EventMetadata metadata();

    /** Logical aggregate type the event belongs to, e.g. {@code "VmRequest"}. */
    String aggregateType();
}
