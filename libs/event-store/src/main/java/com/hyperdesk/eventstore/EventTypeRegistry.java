package com.hyperdesk.eventstore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bidirectional mapping between persisted event type names and event classes.
 *
 * <p>Type names are part of the stored data: renaming a class is fine, renaming its registered
 * type name is a breaking change for existing streams.
 */
public final class EventTypeRegistry {

    private final Map<String, Class<? extends DomainEvent>> classesByName;
    private final Map<Class<? extends DomainEvent>, String> namesByClass;

    private EventTypeRegistry(Map<String, Class<? extends DomainEvent>> classesByName) {
        this.classesByName = Collections.unmodifiableMap(new LinkedHashMap<>(classesByName));
        var reverse = new LinkedHashMap<Class<? extends DomainEvent>, String>();
        classesByName.forEach((name, type) -> reverse.put(type, name));
        this.namesByClass = Collections.unmodifiableMap(reverse);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the registered type name of an event.
     *
     * @throws IllegalArgumentException if the event's class was never registered
     */
    public String typeNameOf(DomainEvent event) {
        String name = namesByClass.get(event.getClass());
        if (name == null) {
            throw new IllegalArgumentException("Unregistered event class: " + event.getClass().getName());
        }
        return name;
    }

    /** Looks up the class for a stored type name. */
    public Optional<Class<? extends DomainEvent>> classFor(String typeName) {
        return Optional.ofNullable(classesByName.get(typeName));
    }

    public boolean isKnown(String typeName) {
        return classesByName.containsKey(typeName);
    }

    public Set<String> typeNames() {
        return classesByName.keySet();
    }

    /** Collects registrations; duplicate names or classes are rejected. */
    public static final class Builder {

        private final Map<String, Class<? extends DomainEvent>> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String typeName, Class<? extends DomainEvent> eventClass) {
            if (typeName == null || typeName.isBlank()) {
                throw new IllegalArgumentException("typeName must not be null or blank");
            }
            if (eventClass == null) {
                throw new IllegalArgumentException("eventClass must not be null");
            }
            if (entries.containsKey(typeName)) {
                throw new IllegalArgumentException("Duplicate event type name: " + typeName);
            }
            if (entries.containsValue(eventClass)) {
                throw new IllegalArgumentException("Event class registered twice: " + eventClass.getName());
            }
            entries.put(typeName, eventClass);
            return this;
        }

        public EventTypeRegistry build() {
            return new EventTypeRegistry(entries);
        }
    }
}
