package com.hyperdesk.eventstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event store kept in process memory.
 * <p>
 * Each append is a compare-and-swap on the stream length performed inside
 * {@link ConcurrentMap#compute}, so concurrent writers to the same stream are serialized and
 * exactly one of several appends with the same expected version wins.
 */
public final class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<UUID, List<StoredEvent>> streams = new ConcurrentHashMap<>();
    private final EventSerializer serializer;
    private final Clock clock;

    public InMemoryEventStore(EventSerializer serializer) {
        this(serializer, Clock.systemUTC());
    }

    public InMemoryEventStore(EventSerializer serializer, Clock clock) {
        if (serializer == null) {
            throw new IllegalArgumentException("serializer must not be null");
        }
        this.serializer = serializer;
        this.clock = clock;
    }

    @Override
    public Result<Long, ConcurrencyConflict> append(UUID aggregateId, List<? extends DomainEvent> events,
                                                    long expectedVersion) {
        EventStreams.requireAppendable(aggregateId, events, expectedVersion);

        var conflict = new AtomicReference<ConcurrencyConflict>();
        List<StoredEvent> updated = streams.compute(aggregateId, (id, current) -> {
            List<StoredEvent> stream = current == null ? List.of() : current;
            if (stream.size() != expectedVersion) {
                conflict.set(new ConcurrencyConflict(id, expectedVersion, stream.size()));
                return current;
            }
            var next = new ArrayList<StoredEvent>(stream.size() + events.size());
            next.addAll(stream);
            long position = expectedVersion;
            for (DomainEvent event : events) {
                next.add(EventStreams.toStoredEvent(serializer, id, event, position++, clock.instant()));
            }
            return List.copyOf(next);
        });

        if (conflict.get() != null) {
            log.debug("Rejected append to {}: expected version {}, actual {}",
                    aggregateId, expectedVersion, conflict.get().actualVersion());
            return Result.failure(conflict.get());
        }
        return Result.success((long) updated.size());
    }

    @Override
    public List<StoredEvent> load(UUID aggregateId) {
        return streams.getOrDefault(aggregateId, List.of());
    }

    @Override
    public long currentVersion(UUID aggregateId) {
        return load(aggregateId).size();
    }
}
