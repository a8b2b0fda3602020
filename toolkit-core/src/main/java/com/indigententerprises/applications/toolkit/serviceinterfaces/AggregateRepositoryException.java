package com.indigententerprises.applications.toolkit.serviceinterfaces;

/**
 * root of the conditions a caller of an aggregate repository is expected to handle.
 */
public abstract class AggregateRepositoryException extends Exception {
    protected AggregateRepositoryException(final String message) {
        super(message);
    }

    protected AggregateRepositoryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
