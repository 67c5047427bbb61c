package com.indigententerprises.applications.pipeline.domain;

/**
 * lifecycle of a job as driven by this pipeline.
 *
 * PENDING -> PROCESSING -> {COMPLETED, FAILED}; the last two accept no further transitions.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(final JobStatus target) {
        switch (this) {
            case PENDING:
                return target == PROCESSING;
            case PROCESSING:
                return target == COMPLETED || target == FAILED;
            default:
                return false;
        }
    }
}
