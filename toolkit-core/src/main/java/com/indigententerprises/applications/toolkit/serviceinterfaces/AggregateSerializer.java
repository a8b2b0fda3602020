package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.DocumentWithId;

public interface AggregateSerializer<A, M extends DocumentWithId> {
    M aggregateToModel(A aggregate);

    A modelToAggregate(M model);
}
