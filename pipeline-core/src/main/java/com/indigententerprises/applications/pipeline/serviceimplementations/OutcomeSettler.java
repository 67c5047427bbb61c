package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.domain.ProcessingOutcome;
import com.indigententerprises.applications.pipeline.serviceinterfaces.Delivery;

/**
 * turns an outcome into the one acknowledgment call its delivery gets.
 */
public final class OutcomeSettler {

    private OutcomeSettler() {}

    public static void settle(final ProcessingOutcome outcome, final Delivery delivery) {
        if (outcome instanceof ProcessingOutcome.RejectTransient) {
            delivery.nack(true);
        } else if (outcome instanceof ProcessingOutcome.RejectPermanent) {
            delivery.nack(false);
        } else {
            delivery.ack();
        }
    }
}
