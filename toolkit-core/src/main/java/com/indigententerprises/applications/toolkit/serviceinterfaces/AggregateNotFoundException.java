package com.indigententerprises.applications.toolkit.serviceinterfaces;

public class AggregateNotFoundException extends AggregateRepositoryException {
    public AggregateNotFoundException(final String message) {
        super(message);
    }

    public AggregateNotFoundException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
