package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Event;

@FunctionalInterface
public interface EventHandler<P> {
    void handle(Event<P> event) throws Exception;
}
