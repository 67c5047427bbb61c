package com.indigententerprises.applications.pipeline.serviceinterfaces;

/**
 * the unit of work itself failed for good; the job ends FAILED instead of being retried.
 */
public class JobExecutionException extends Exception {
    public JobExecutionException(final String message) {
        super(message);
    }

    public JobExecutionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
