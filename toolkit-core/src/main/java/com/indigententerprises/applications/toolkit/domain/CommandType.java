package com.indigententerprises.applications.toolkit.domain;

import java.util.Objects;

public record CommandType<P, R>(String name, Class<P> payloadClass, Class<R> resultClass) {

    public CommandType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(payloadClass, "payloadClass");
        Objects.requireNonNull(resultClass, "resultClass");
    }

    public static <P, R> CommandType<P, R> of(final String name, final Class<P> payloadClass, final Class<R> resultClass) {
        return new CommandType<>(name, payloadClass, resultClass);
    }

    public Command<P, R> create(final P payload) {
        return new Command<>(this, payload);
    }
}
