package com.hyperdesk.eventstore;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for event-sourced aggregates.
 * <p>
 * State only changes through {@link #applyEvent(DomainEvent)}, which delegates to the
 * subclass's {@link #handleEvent(DomainEvent)} and bumps the version. New events are kept as
 * uncommitted until the caller has appended them and calls {@link #clearUncommittedEvents()}.
 *
 * @param <ID> aggregate identifier type
 */
public abstract class AggregateRoot<ID> {

    private final List<DomainEvent> uncommittedEvents = new ArrayList<>();
    private long version;

    /** The aggregate's identity. */
    public abstract ID id();

    /**
     * Applies one event to in-memory state. Must be total over the aggregate's event types and
     * free of side effects.
     */
    protected abstract void handleEvent(DomainEvent event);

    /** Applies a newly produced event and records it as uncommitted. */
    protected final void applyEvent(DomainEvent event) {
        handleEvent(event);
        version++;
        uncommittedEvents.add(event);
    }

    /** Applies a historical event during reconstitution. */
    protected final void replay(DomainEvent event) {
        handleEvent(event);
        version++;
    }

    /** Number of events applied so far, committed or not. */
    public long version() {
        return version;
    }

    /** Stream length before the uncommitted events; the expected version for the next append. */
    public long committedVersion() {
        return version - uncommittedEvents.size();
    }

    public List<DomainEvent> uncommittedEvents() {
        return List.copyOf(uncommittedEvents);
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /** Call only after the uncommitted events were appended successfully. */
    public void clearUncommittedEvents() {
        uncommittedEvents.clear();
    }
}
