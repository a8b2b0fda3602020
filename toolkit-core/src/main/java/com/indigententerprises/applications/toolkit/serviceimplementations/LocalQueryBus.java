package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.domain.Query;
import com.indigententerprises.applications.toolkit.domain.QueryType;
import com.indigententerprises.applications.toolkit.serviceinterfaces.DuplicateHandlerException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.HandlerExecutionException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.NoHandlerException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.QueryBus;
import com.indigententerprises.applications.toolkit.serviceinterfaces.QueryHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * synchronous, no retries.
 */
public class LocalQueryBus implements QueryBus {

    private final Logger logger;
    private final Map<String, Registration<?, ?>> registrations = new ConcurrentHashMap<>();

    public LocalQueryBus() {
        this(LoggerFactory.getLogger(LocalQueryBus.class));
    }

    public LocalQueryBus(final Logger logger) {
        this.logger = logger;
    }

    @Override
    public <P, R> void register(final QueryType<P, R> queryType, final QueryHandler<P, R> handler) {
        if (registrations.putIfAbsent(queryType.name(), new Registration<>(queryType, handler)) != null) {
            throw new DuplicateHandlerException("Query " + queryType.name() + " is already registered");
        }
        logger.debug("Query {} registered", queryType.name());
    }

    @Override
    public <P, R> R execute(final Query<P, R> query) {
        final Registration<?, ?> registration = registrations.get(query.getName());

        if (registration == null) {
            throw new NoHandlerException("No handler found for " + query.getName());
        }

        if (!registration.queryType().equals(query.getType())) {
            throw new IllegalArgumentException("Query " + query.getName() + " is registered as " + registration.queryType());
        }

        try {
            return query.getType().resultClass().cast(registration.handle(query));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerExecutionException("handler of " + query.getName() + " failed", e);
        }
    }

    private record Registration<P, R>(QueryType<P, R> queryType, QueryHandler<P, R> handler) {

        R handle(final Query<?, ?> query) throws Exception {
            return handler.handle(queryType.create(queryType.payloadClass().cast(query.getPayload())));
        }
    }
}
