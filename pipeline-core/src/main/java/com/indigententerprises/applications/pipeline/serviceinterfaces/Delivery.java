package com.indigententerprises.applications.pipeline.serviceinterfaces;

/**
 * handle on one inbound delivery. must be resolved exactly once.
 */
public interface Delivery {
    void ack();

    void nack(final boolean requeue);
}
