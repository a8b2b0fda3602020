package com.indigententerprises.applications.toolkit.domain;

import java.util.Objects;

public final class Query<P, R> {
    private final QueryType<P, R> type;
    private final P payload;

    public Query(final QueryType<P, R> type, final P payload) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload;
    }

    public QueryType<P, R> getType() {
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
        return "Query{name=" + type.name() + ", payload=" + payload + "}";
    }
}
