package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Event;
import com.indigententerprises.applications.toolkit.domain.EventType;

public interface EventBus {

    /**
     * @param handlerName stable identity of the handler; shows up in logs and, for the broker bus,
     *                    determines the queue the handler consumes from.
     */
    <P> void subscribe(EventType<P> eventType, String handlerName, EventHandler<P> handler);

    void publish(Event<?> event);
}
