package com.indigententerprises.applications.toolkit.domain;

import java.util.Objects;

public record QueryType<P, R>(String name, Class<P> payloadClass, Class<R> resultClass) {

    public QueryType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(payloadClass, "payloadClass");
        Objects.requireNonNull(resultClass, "resultClass");
    }

    public static <P, R> QueryType<P, R> of(final String name, final Class<P> payloadClass, final Class<R> resultClass) {
        return new QueryType<>(name, payloadClass, resultClass);
    }

    public Query<P, R> create(final P payload) {
        return new Query<>(this, payload);
    }
}
