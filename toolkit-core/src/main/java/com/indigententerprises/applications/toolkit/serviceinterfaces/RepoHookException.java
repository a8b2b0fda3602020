package com.indigententerprises.applications.toolkit.serviceinterfaces;

/**
 * a save hook failed; the save transaction has been rolled back.
 */
public class RepoHookException extends AggregateRepositoryException {
    public RepoHookException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
