package com.indigententerprises.applications.toolkit.serviceinterfaces;

/**
 * a handler invoked on behalf of a synchronous caller failed (after retries, where they apply).
 */
public class HandlerExecutionException extends RuntimeException {
    public HandlerExecutionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
