package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.ConcurrencyConflict;
import com.hyperdesk.eventstore.EventSerializer;
import com.hyperdesk.eventstore.EventSerializer.EventSerializationException;
import com.hyperdesk.eventstore.EventStore;
import com.hyperdesk.eventstore.EventStoreException;
import com.hyperdesk.eventstore.Result;
import com.hyperdesk.eventstore.StoredEvent;
import com.hyperdesk.tenant.TenantIsolationEnforcer;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import com.hyperdesk.vmrequest.domain.events.VmRequestEventTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Loads and commits VM request aggregates against the event store, translating store outcomes
 * into {@link VmRequestError}s.
 */
public class VmRequestEventStream {

    private static final Logger log = LoggerFactory.getLogger(VmRequestEventStream.class);

    private final EventStore eventStore;
    private final EventSerializer serializer;

    public VmRequestEventStream(EventStore eventStore) {
        this(eventStore, new EventSerializer(VmRequestEventTypes.REGISTRY));
    }

    public VmRequestEventStream(EventStore eventStore, EventSerializer serializer) {
        this.eventStore = eventStore;
        this.serializer = serializer;
    }

    /**
     * Reconstitutes a request from its full stream.
     *
     * @return the aggregate, {@code NotFound} for an empty stream, or {@code PersistenceFailure}
     */
    public Result<VmRequestAggregate, VmRequestError> load(VmRequestId id) {
        return history(id).map(events -> VmRequestAggregate.reconstitute(id, events));
    }

    /**
     * Reads and deserializes the stream in version order.
     *
     * @return the events, {@code NotFound} for an empty stream, or {@code PersistenceFailure}
     */
    public Result<List<VmRequestEvent>, VmRequestError> history(VmRequestId id) {
        List<StoredEvent> stored;
        try {
            stored = eventStore.load(id.value());
        } catch (EventStoreException e) {
            log.error("Failed to load event stream of VM request {}", id, e);
            return Result.failure(new VmRequestError.PersistenceFailure("Failed to load VM request " + id));
        }
        if (stored.isEmpty()) {
            return Result.failure(new VmRequestError.NotFound(id));
        }
        try {
            return Result.success(serializer.deserializeAll(stored).stream()
                    .map(VmRequestEvent.class::cast)
                    .toList());
        } catch (EventSerializationException | ClassCastException e) {
            log.error("Event stream of VM request {} cannot be deserialized", id, e);
            return Result.failure(new VmRequestError.PersistenceFailure("Corrupt event stream for VM request " + id));
        }
    }

    /**
     * Like {@link #load(VmRequestId)}, but a request of another tenant is reported as
     * {@code NotFound} so its existence is not revealed.
     */
    public Result<VmRequestAggregate, VmRequestError> loadForTenant(VmRequestId id, String tenantId) {
        Result<VmRequestAggregate, VmRequestError> loaded = load(id);
        if (loaded.isSuccess() && !TenantIsolationEnforcer.belongsTo(tenantId, loaded.value().tenantId())) {
            log.warn("Tenant {} asked for VM request {} owned by another tenant", tenantId, id);
            return Result.failure(new VmRequestError.NotFound(id));
        }
        return loaded;
    }

    /**
     * Appends the aggregate's uncommitted events with its committed version as the expected
     * version, then clears them. Nothing is appended when there are no new events.
     *
     * @return the stream length after the commit
     */
    public Result<Long, VmRequestError> commit(VmRequestAggregate aggregate) {
        if (!aggregate.hasUncommittedEvents()) {
            return Result.success(aggregate.version());
        }
        long expectedVersion = aggregate.committedVersion();
        Result<Long, ConcurrencyConflict> appended;
        try {
            appended = eventStore.append(aggregate.id().value(), aggregate.uncommittedEvents(), expectedVersion);
        } catch (EventStoreException e) {
            log.error("Failed to append events of VM request {} for tenant {}", aggregate.id(), aggregate.tenantId(), e);
            return Result.failure(new VmRequestError.PersistenceFailure("Failed to persist VM request " + aggregate.id()));
        }
        if (appended.isFailure()) {
            ConcurrencyConflict conflict = appended.error();
            log.warn("Concurrent modification of VM request {}: expected version {}, actual {}",
                    aggregate.id(), conflict.expectedVersion(), conflict.actualVersion());
            return Result.failure(new VmRequestError.ConcurrencyConflict(
                    conflict.expectedVersion(), conflict.actualVersion()));
        }
        aggregate.clearUncommittedEvents();
        return Result.success(appended.value());
    }

    /** Uncommitted events as typed VM request events, captured before {@link #commit}. */
    public static List<VmRequestEvent> pendingEvents(VmRequestAggregate aggregate) {
        return aggregate.uncommittedEvents().stream()
                .map(VmRequestEvent.class::cast)
                .toList();
    }
}
