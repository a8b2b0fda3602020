package com.indigententerprises.applications.toolkit.domain;

import java.util.Objects;

public final class Event<P> {
    private final String name;
    private final P payload;

    public Event(final String name, final P payload) {
        this.name = Objects.requireNonNull(name, "name");
        this.payload = payload;
    }

    public String getName() {
        return name;
    }

    public P getPayload() {
        return payload;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof Event<?> other)) {
            return false;
        } else {
            return name.equals(other.name) && Objects.equals(payload, other.payload);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, payload);
    }

    @Override
    public String toString() {
        return "Event{name=" + name + ", payload=" + payload + "}";
    }
}
