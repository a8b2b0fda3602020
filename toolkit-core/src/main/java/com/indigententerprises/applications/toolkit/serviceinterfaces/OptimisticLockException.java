package com.indigententerprises.applications.toolkit.serviceinterfaces;

public class OptimisticLockException extends AggregateRepositoryException {
    public OptimisticLockException(final String message) {
        super(message);
    }

    public OptimisticLockException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
