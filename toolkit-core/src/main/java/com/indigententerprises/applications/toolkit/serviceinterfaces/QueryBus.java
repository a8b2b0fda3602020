package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Query;
import com.indigententerprises.applications.toolkit.domain.QueryType;

public interface QueryBus {
    <P, R> void register(QueryType<P, R> queryType, QueryHandler<P, R> handler);

    <P, R> R execute(Query<P, R> query);
}
