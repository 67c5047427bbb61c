package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.domain.DeliveryInfo;
import com.indigententerprises.applications.pipeline.domain.EventDisposition;
import com.indigententerprises.applications.pipeline.domain.JobStatus;
import com.indigententerprises.applications.pipeline.serviceinterfaces.InvalidStateException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * in-memory lifecycle of one job. no I/O.
 *
 * illegal transitions are not errors: they return false and leave the status alone, so replaying
 * an already-processed message is a no-op. duplicate detection is scoped to this instance.
 */
public final class JobStateMachine {

    private static final Logger log = LoggerFactory.getLogger(JobStateMachine.class);

    private final String jobId;
    private final Set<String> processedEventIds;

    // mutable data
    private JobStatus status;

    public JobStateMachine(final String jobId, final String initialStatus) throws InvalidStateException {
        this.jobId = jobId;
        this.status = parse(initialStatus);
        this.processedEventIds = new LinkedHashSet<>();
    }

    public JobStatus getStatus() {
        return status;
    }

    public Set<String> getProcessedEventIds() {
        return Collections.unmodifiableSet(processedEventIds);
    }

    public boolean transition(final JobStatus target) {
        if (status.canTransitionTo(target)) {
            log.debug("job {}: {} -> {}", jobId, status, target);
            status = target;
            return true;
        } else {
            log.info("job {}: transition {} -> {} not applied", jobId, status, target);
            return false;
        }
    }

    /**
     * the delivery metadata is logged and nothing else; a redelivered flag never changes the answer.
     */
    public EventDisposition processEvent(final String eventId, final DeliveryInfo delivery) {
        if (processedEventIds.add(eventId)) {
            log.debug(
                    "job {}: event {} processed (delivery tag {}, redelivered {})",
                    jobId,
                    eventId,
                    delivery == null ? null : delivery.deliveryTag(),
                    delivery == null ? null : delivery.redelivered()
            );
            return EventDisposition.PROCESSED;
        } else {
            log.info(
                    "job {}: duplicate event {} ignored (delivery tag {}, redelivered {})",
                    jobId,
                    eventId,
                    delivery == null ? null : delivery.deliveryTag(),
                    delivery == null ? null : delivery.redelivered()
            );
            return EventDisposition.DUPLICATE;
        }
    }

    private static JobStatus parse(final String value) throws InvalidStateException {
        if (value == null) {
            throw new InvalidStateException("job status is missing");
        } else {
            try {
                return JobStatus.valueOf(value);
            } catch (IllegalArgumentException e) {
                throw new InvalidStateException("not a job status: " + value, e);
            }
        }
    }
}
