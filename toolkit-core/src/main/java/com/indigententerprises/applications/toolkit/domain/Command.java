package com.indigententerprises.applications.toolkit.domain;

import java.util.Objects;

public final class Command<P, R> {
    private final CommandType<P, R> type;
    private final P payload;

    public Command(final CommandType<P, R> type, final P payload) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload;
    }

    public CommandType<P, R> getType() {
        return type;
    }

    public String getName() {
        return type.name();
    }

    public P getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "Command{name=" + type.name() + ", payload=" + payload + "}";
    }
}
