package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Command;

/**
 * a command handler that also receives the ambient context opened by a {@link ContextManager}.
 * the context is null when the bus has no context manager.
 */
@FunctionalInterface
public interface ContextualCommandHandler<P, R, C> {
    R handle(Command<P, R> command, C context) throws Exception;
}
