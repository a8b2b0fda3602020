package com.indigententerprises.applications.rabbitbus.serviceinterfaces;

/**
 * the broker did not confirm a published event.
 */
public class PublishFailedException extends RuntimeException {
    public PublishFailedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
