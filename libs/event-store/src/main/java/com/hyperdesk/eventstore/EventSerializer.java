package com.hyperdesk.eventstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;
import java.util.Optional;

/**
 * JSON conversion between {@link DomainEvent} records and stored payloads.
 * <p>
 * Dates are written as ISO-8601 strings. Unknown properties are ignored on read so that
 * adding a field to an event does not break replay of older streams.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private final EventTypeRegistry registry;

    public EventSerializer(EventTypeRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Registered type name for the event. */
    public String typeNameOf(DomainEvent event) {
        return registry.typeNameOf(event);
    }

    /**
     * Serializes an event to its JSON payload.
     *
     * @throws EventSerializationException if Jackson cannot write the event
     */
    public String serialize(DomainEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to serialize event " + event.getClass().getSimpleName(), e);
        }
    }

    /**
     * Rebuilds the domain event held by a stored event.
     *
     * @throws EventSerializationException if the type is unknown or the payload is malformed
     */
    public DomainEvent deserialize(StoredEvent stored) {
        Class<? extends DomainEvent> type = registry.classFor(stored.eventType())
                .orElseThrow(() -> new EventSerializationException(
                        "Unknown event type '" + stored.eventType() + "' at version " + stored.version()
                                + " of aggregate " + stored.aggregateId(), null));
        try {
            return MAPPER.readValue(stored.payload(), type);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(
                    "Failed to deserialize " + stored.eventType() + " at version " + stored.version()
                            + " of aggregate " + stored.aggregateId(), e);
        }
    }

    /** Deserializes a whole stream, preserving order. */
    public List<DomainEvent> deserializeAll(List<StoredEvent> stream) {
        return stream.stream().map(this::deserialize).toList();
    }

    /** Deserializes, returning empty on any failure. */
    public Optional<DomainEvent> tryDeserialize(StoredEvent stored) {
        try {
            return Optional.of(deserialize(stored));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Thrown when an event cannot be written or read back.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
