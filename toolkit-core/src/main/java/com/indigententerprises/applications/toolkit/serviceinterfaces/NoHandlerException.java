package com.indigententerprises.applications.toolkit.serviceinterfaces;

public class NoHandlerException extends RuntimeException {
    public NoHandlerException(final String message) {
        super(message);
    }
}
