package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.domain.Event;
import com.indigententerprises.applications.toolkit.domain.EventType;
import com.indigententerprises.applications.toolkit.serviceinterfaces.EventBus;
import com.indigententerprises.applications.toolkit.serviceinterfaces.EventHandler;
import com.indigententerprises.applications.toolkit.serviceinterfaces.HandlerExecutionException;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * in-process event bus: any number of handlers per event name, each invoked once per publish.
 */
public class LocalEventBus implements EventBus {

    private final ObjectMapper objectMapper;
    private final Logger logger;
    private final RetryingDispatcher dispatcher;
    private final Map<String, List<Subscription<?>>> handlers = new ConcurrentHashMap<>();

    public LocalEventBus(final ObjectMapper objectMapper, final LocalBusConfig config) {
        this.objectMapper = objectMapper;
        this.logger = config.getLogger(LocalEventBus.class);
        this.dispatcher = new RetryingDispatcher(config, logger, "local-event-bus-");
    }

    @Override
    public <P> void subscribe(final EventType<P> eventType, final String handlerName, final EventHandler<P> handler) {
        handlers.computeIfAbsent(eventType.name(), name -> new CopyOnWriteArrayList<>())
                .add(new Subscription<>(eventType, handlerName, handler));
        logger.debug("{} subscribed to {}", handlerName, eventType.name());
    }

    /**
     * returns once every handler has been dispatched, not once they have completed.
     */
    @Override
    public void publish(final Event<?> event) {
        final List<Subscription<?>> subscriptions = subscriptionsFor(event);

        if (subscriptions.isEmpty()) {
            logger.warn("No handler found for {}", event.getName());
        } else {
            for (final Subscription<?> subscription : subscriptions) {
                dispatcher.dispatch(
                        subscription.handlerName(),
                        event.getName(),
                        "event",
                        () -> subscription.deliver(event, objectMapper),
                        true
                );
            }
        }
    }

    /**
     * blocks until every handler has succeeded or run out of attempts.
     *
     * @throws HandlerExecutionException when at least one handler ultimately failed
     */
    public void publishAndWaitForHandlers(final Event<?> event) {
        final List<Subscription<?>> subscriptions = subscriptionsFor(event);

        if (subscriptions.isEmpty()) {
            logger.warn("No handler found for {}", event.getName());
            return;
        }

        final List<CompletableFuture<Void>> outcomes = new ArrayList<>(subscriptions.size());

        for (final Subscription<?> subscription : subscriptions) {
            outcomes.add(dispatcher.dispatch(
                    subscription.handlerName(),
                    event.getName(),
                    "event",
                    () -> subscription.deliver(event, objectMapper),
                    false
            ));
        }

        HandlerExecutionException failure = null;

        for (int i = 0; i < outcomes.size(); i++) {
            try {
                outcomes.get(i).join();
            } catch (CompletionException e) {
                final HandlerExecutionException handlerFailure = new HandlerExecutionException(
                        subscriptions.get(i).handlerName() + " failed to handle " + event.getName() + " event",
                        e.getCause()
                );

                if (failure == null) {
                    failure = handlerFailure;
                } else {
                    failure.addSuppressed(handlerFailure);
                }
            }
        }

        if (failure != null) {
            throw failure;
        }
    }

    /**
     * cancels pending retries; running handlers are interrupted.
     */
    public void terminate() {
        dispatcher.shutdown();
    }

    private List<Subscription<?>> subscriptionsFor(final Event<?> event) {
        final List<Subscription<?>> subscriptions = handlers.get(event.getName());
        return subscriptions == null ? List.of() : subscriptions;
    }

    private record Subscription<P>(EventType<P> eventType, String handlerName, EventHandler<P> handler) {
        void deliver(final Event<?> event, final ObjectMapper objectMapper) throws Exception {
            handler.handle(eventType.coerce(event, objectMapper));
        }
    }
}
