package com.indigententerprises.applications.toolkit.domain;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * registration key for an event: the name routes the event, the payload class is what handlers
 * expect to receive once the event has crossed a serialization boundary.
 */
public record EventType<P>(String name, Class<P> payloadClass) {

    public EventType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(payloadClass, "payloadClass");
    }

    public static <P> EventType<P> of(final String name, final Class<P> payloadClass) {
        return new EventType<>(name, payloadClass);
    }

    public Event<P> create(final P payload) {
        return new Event<>(name, payload);
    }

    /**
     * re-binds the payload of an event to this type's payload class.
     * payloads read back from the outbox or the broker arrive as json trees.
     */
    public Event<P> coerce(final Event<?> event, final ObjectMapper objectMapper) {
        if (!name.equals(event.getName())) {
            throw new IllegalArgumentException("event " + event.getName() + " is not of type " + name);
        }

        final Object payload = event.getPayload();

        if (payload == null || payloadClass.isInstance(payload)) {
            return new Event<>(name, payloadClass.cast(payload));
        } else {
            return new Event<>(name, objectMapper.convertValue(payload, payloadClass));
        }
    }
}
