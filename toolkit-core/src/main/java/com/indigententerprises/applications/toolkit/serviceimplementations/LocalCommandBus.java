package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.domain.Command;
import com.indigententerprises.applications.toolkit.domain.CommandType;
import com.indigententerprises.applications.toolkit.serviceinterfaces.CommandBus;
import com.indigententerprises.applications.toolkit.serviceinterfaces.CommandHandler;
import com.indigententerprises.applications.toolkit.serviceinterfaces.ContextManager;
import com.indigententerprises.applications.toolkit.serviceinterfaces.ContextualCommandHandler;
import com.indigententerprises.applications.toolkit.serviceinterfaces.DuplicateHandlerException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.HandlerExecutionException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.NoHandlerException;

import org.slf4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * one handler per command name. every execution runs inside the context manager's context,
 * when one is configured.
 *
 * @param <C> type of the ambient context handed to contextual handlers
 */
public class LocalCommandBus<C> implements CommandBus {

    private final Logger logger;
    private final RetryingDispatcher dispatcher;
    private final ContextManager<C> contextManager;
    private final Map<String, Registration<?, ?, C>> registrations = new ConcurrentHashMap<>();

    public LocalCommandBus(final LocalBusConfig config) {
        this(config, null);
    }

    public LocalCommandBus(final LocalBusConfig config, final ContextManager<C> contextManager) {
        this.logger = config.getLogger(LocalCommandBus.class);
        this.dispatcher = new RetryingDispatcher(config, logger, "local-command-bus-");
        this.contextManager = contextManager;
    }

    @Override
    public <P, R> void register(final CommandType<P, R> commandType, final CommandHandler<P, R> handler) {
        registerContextual(commandType, (command, context) -> handler.handle(command));
    }

    public <P, R> void registerContextual(
            final CommandType<P, R> commandType,
            final ContextualCommandHandler<P, R, C> handler
    ) {
        if (registrations.putIfAbsent(commandType.name(), new Registration<>(commandType, handler)) != null) {
            throw new DuplicateHandlerException("Command " + commandType.name() + " is already registered");
        }
        logger.debug("Command {} registered", commandType.name());
    }

    @Override
    public <P, R> void send(final Command<P, R> command) {
        final Registration<?, ?, C> registration = registrationFor(command);

        if (registration == null) {
            logger.warn("No handler found for {}", command.getName());
        } else {
            dispatcher.dispatch(
                    command.getName() + " handler",
                    command.getName(),
                    "command",
                    () -> invoke(registration, command),
                    true
            );
        }
    }

    @Override
    public <P, R> R sendSync(final Command<P, R> command) {
        final Registration<?, ?, C> registration = registrationFor(command);

        if (registration == null) {
            throw new NoHandlerException("No handler found for " + command.getName());
        }

        try {
            return invoke(registration, command);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerExecutionException("handler of " + command.getName() + " failed", e);
        }
    }

    public void terminate() {
        dispatcher.shutdown();
    }

    private <P, R> R invoke(final Registration<?, ?, C> registration, final Command<P, R> command) throws Exception {
        final Object result;

        if (contextManager == null) {
            result = registration.handle(command, null);
        } else {
            result = contextManager.wrapWithContext(context -> registration.handle(command, context));
        }

        return command.getType().resultClass().cast(result);
    }

    private Registration<?, ?, C> registrationFor(final Command<?, ?> command) {
        final Registration<?, ?, C> registration = registrations.get(command.getName());

        if (registration != null && !registration.commandType().equals(command.getType())) {
            throw new IllegalArgumentException(
                    "Command " + command.getName() + " is registered as " + registration.commandType()
            );
        }

        return registration;
    }

    /**
     * a handler kept with the command type it was registered for, which re-types incoming commands.
     */
    private record Registration<P, R, C>(CommandType<P, R> commandType, ContextualCommandHandler<P, R, C> handler) {

        R handle(final Command<?, ?> command, final C context) throws Exception {
            return handler.handle(commandType.create(commandType.payloadClass().cast(command.getPayload())), context);
        }
    }
}
