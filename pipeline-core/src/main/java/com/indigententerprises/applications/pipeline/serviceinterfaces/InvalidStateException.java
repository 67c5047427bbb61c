package com.indigententerprises.applications.pipeline.serviceinterfaces;

public class InvalidStateException extends Exception {
    public InvalidStateException(final String message) {
        super(message);
    }

    public InvalidStateException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
