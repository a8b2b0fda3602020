package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Query;

@FunctionalInterface
public interface QueryHandler<P, R> {
    R handle(Query<P, R> query) throws Exception;
}
