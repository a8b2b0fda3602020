package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Event;

import java.util.List;

/**
 * bridge from the outbox to whatever delivers events (a local bus, a broker).
 * the outbox calls it with exactly one event per publish attempt.
 */
@FunctionalInterface
public interface PublishEventsCallback {
    void publish(List<Event<?>> events) throws Exception;
}
