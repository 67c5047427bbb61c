package com.indigententerprises.applications.pipeline.domain;

/**
 * transport-level metadata of one delivery. informational only: never part of a de-duplication decision.
 */
public record DeliveryInfo(
        String topic,
        int partition,
        long deliveryTag,
        boolean redelivered
) {}
