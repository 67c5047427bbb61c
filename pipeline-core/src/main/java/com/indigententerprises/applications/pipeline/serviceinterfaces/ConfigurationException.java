package com.indigententerprises.applications.pipeline.serviceinterfaces;

/**
 * startup-time problem (missing contract document, bad version descriptor). the process must not consume.
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
