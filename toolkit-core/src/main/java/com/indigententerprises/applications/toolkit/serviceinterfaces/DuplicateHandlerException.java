package com.indigententerprises.applications.toolkit.serviceinterfaces;

public class DuplicateHandlerException extends RuntimeException {
    public DuplicateHandlerException(final String message) {
        super(message);
    }
}
