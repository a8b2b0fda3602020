package com.indigententerprises.applications.toolkit.serviceinterfaces;

/**
 * opens an ambient context (unit of work, trace scope, ...) around a command execution.
 */
public interface ContextManager<C> {

    <T> T wrapWithContext(ContextualOperation<C, T> operation) throws Exception;

    @FunctionalInterface
    interface ContextualOperation<C, T> {
        T apply(C context) throws Exception;
    }
}
