package com.indigententerprises.applications.toolkit.serviceinterfaces;

public class DuplicatedIdException extends AggregateRepositoryException {
    public DuplicatedIdException(final String message) {
        super(message);
    }

    public DuplicatedIdException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
