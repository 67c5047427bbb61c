package com.indigententerprises.applications.pipeline.domain;

/**
 * how one inbound delivery must be resolved. exactly one of these is produced per delivery.
 */
public sealed interface ProcessingOutcome
        permits ProcessingOutcome.Acknowledge, ProcessingOutcome.RejectPermanent, ProcessingOutcome.RejectTransient {

    record Acknowledge() implements ProcessingOutcome {}

    /** the message will never become valid; drop it without redelivery */
    record RejectPermanent(String diagnostic) implements ProcessingOutcome {}

    /** infrastructure trouble; redeliver */
    record RejectTransient(Exception cause) implements ProcessingOutcome {}

    static ProcessingOutcome acknowledge() {
        return new Acknowledge();
    }

    static ProcessingOutcome rejectPermanent(final String diagnostic) {
        return new RejectPermanent(diagnostic);
    }

    static ProcessingOutcome rejectTransient(final Exception cause) {
        return new RejectTransient(cause);
    }
}
