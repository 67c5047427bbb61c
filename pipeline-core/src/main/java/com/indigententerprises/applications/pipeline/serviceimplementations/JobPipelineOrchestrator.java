package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.domain.ContractValidation;
import com.indigententerprises.applications.pipeline.domain.DeliveryInfo;
import com.indigententerprises.applications.pipeline.domain.EventDisposition;
import com.indigententerprises.applications.pipeline.domain.EventEnvelope;
import com.indigententerprises.applications.pipeline.domain.EventPayload;
import com.indigententerprises.applications.pipeline.domain.ErrorKind;
import com.indigententerprises.applications.pipeline.domain.JobRecord;
import com.indigententerprises.applications.pipeline.domain.JobStatus;
import com.indigententerprises.applications.pipeline.domain.ProcessingOutcome;
import com.indigententerprises.applications.pipeline.domain.ServiceIdentity;
import com.indigententerprises.applications.pipeline.infrastructure.ProcessorMetrics;
import com.indigententerprises.applications.pipeline.serviceinterfaces.InvalidStateException;
import com.indigententerprises.applications.pipeline.serviceinterfaces.JobExecutionException;
import com.indigententerprises.applications.pipeline.serviceinterfaces.JobStore;
import com.indigententerprises.applications.pipeline.serviceinterfaces.JobWork;

import io.micrometer.core.instrument.Timer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeoutException;

/**
 * handles one inbound delivery end to end and says how it must be resolved.
 * <p>
 * parse -> validate -> (quarantine) -> state transition -> persist -> work -> persist -> publish completion.
 * nothing escapes {@link #handle}: every path ends in exactly one {@link ProcessingOutcome}.
 * <ul>
 *   <li>unparseable body: permanent, no quarantine record possible</li>
 *   <li>contract violation: permanent, quarantined with diagnostics</li>
 *   <li>anything thrown while persisting, working or publishing: transient</li>
 * </ul>
 */
public final class JobPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobPipelineOrchestrator.class);

    static final String MDC_CORRELATION_ID = "correlation.id";
    static final String MDC_EVENT_ID = "event.id";
    static final String MDC_JOB_ID = "job.id";

    private final ObjectMapper objectMapper;
    private final ContractValidator contractValidator;
    private final JobStore jobStore;
    private final JobWork jobWork;
    private final CompletionPublisher completionPublisher;
    private final DeadLetterRouter deadLetterRouter;
    private final ProcessorMetrics metrics;
    private final ServiceIdentity serviceIdentity;
    private final Clock clock;

    public JobPipelineOrchestrator(
            final ObjectMapper objectMapper,
            final ContractValidator contractValidator,
            final JobStore jobStore,
            final JobWork jobWork,
            final CompletionPublisher completionPublisher,
            final DeadLetterRouter deadLetterRouter,
            final ProcessorMetrics metrics,
            final ServiceIdentity serviceIdentity,
            final Clock clock
    ) {
        this.objectMapper = objectMapper;
        this.contractValidator = contractValidator;
        this.jobStore = jobStore;
        this.jobWork = jobWork;
        this.completionPublisher = completionPublisher;
        this.deadLetterRouter = deadLetterRouter;
        this.metrics = metrics;
        this.serviceIdentity = serviceIdentity;
        this.clock = clock;
    }

    public ProcessingOutcome handle(final String body, final DeliveryInfo delivery) {
        final Timer.Sample sample = metrics.messageSeen();

        try {
            final JsonNode root = parse(body);

            if (root == null) {
                metrics.validationFailed();
                log.warn(
                        "discarding unparseable message {}-{}@{}",
                        delivery.topic(),
                        delivery.partition(),
                        delivery.deliveryTag()
                );
                return ProcessingOutcome.rejectPermanent("message body is not parseable");
            } else {
                MDC.put(MDC_CORRELATION_ID, DeadLetterRouter.extractCorrelationId(root));
                return handleParsed(root, delivery, sample);
            }
        } finally {
            MDC.remove(MDC_CORRELATION_ID);
            MDC.remove(MDC_EVENT_ID);
            MDC.remove(MDC_JOB_ID);
        }
    }

    private ProcessingOutcome handleParsed(
            final JsonNode root,
            final DeliveryInfo delivery,
            final Timer.Sample sample
    ) {
        final ContractValidation validation = contractValidator.validate(root);

        if (!validation.valid()) {
            return quarantine(root, validation.errorKind(), validation.diagnostic(), delivery);
        }

        final EventEnvelope envelope;
        final EventPayload payload;

        try {
            // validate BEFORE binding
            envelope = objectMapper.treeToValue(root, EventEnvelope.class);
            payload = bindPayload(envelope);
        } catch (JsonProcessingException e) {
            return quarantine(root, ErrorKind.UNBINDABLE, "Envelope binding failed: " + e.getOriginalMessage(), delivery);
        }

        MDC.put(MDC_EVENT_ID, envelope.eventId());
        log.info(
                "received {} event {} (delivery tag {}, redelivered {})",
                envelope.eventType(),
                envelope.eventId(),
                delivery.deliveryTag(),
                delivery.redelivered()
        );

        if (payload instanceof EventPayload.JobPayload jobPayload) {
            return processJob(root, envelope, jobPayload.job(), delivery, sample);
        } else {
            log.info("event type {} carries no job; nothing to do", envelope.eventType());
            return ProcessingOutcome.acknowledge();
        }
    }

    private ProcessingOutcome processJob(
            final JsonNode root,
            final EventEnvelope envelope,
            final JobRecord job,
            final DeliveryInfo delivery,
            final Timer.Sample sample
    ) {
        MDC.put(MDC_JOB_ID, job.id());

        final JobStateMachine machine;

        try {
            machine = new JobStateMachine(job.id(), job.status());
        } catch (InvalidStateException e) {
            return quarantine(root, ErrorKind.PAYLOAD_INVALID, "Payload validation failed: " + e.getMessage(), delivery);
        }

        if (machine.processEvent(envelope.eventId(), delivery) == EventDisposition.DUPLICATE) {
            return ProcessingOutcome.acknowledge();
        }

        if (machine.getStatus().isTerminal()) {
            log.info("job {} is already {}; acknowledging without side effects", job.id(), machine.getStatus());
            return ProcessingOutcome.acknowledge();
        }

        // a PROCESSING job is a replay that died between the two writes; it resumes here
        machine.transition(JobStatus.PROCESSING);

        try {
            if (!jobStore.upsert(job, machine.getStatus())) {
                log.info("job {} is already finished in the store; acknowledging without side effects", job.id());
                return ProcessingOutcome.acknowledge();
            }

            try {
                jobWork.perform(job);
            } catch (JobExecutionException e) {
                machine.transition(JobStatus.FAILED);
                jobStore.updateStatus(job.id(), machine.getStatus());
                metrics.failed();
                log.warn("job {} failed: {}", job.id(), e.getMessage());
                return ProcessingOutcome.acknowledge();
            }

            machine.transition(JobStatus.COMPLETED);
            jobStore.updateStatus(job.id(), machine.getStatus());

            // the envelope contract admits objects only, so a validated root is always an ObjectNode
            final ObjectNode completionEvent = EventEnvelope.toCompletionEvent(
                    (ObjectNode) root,
                    serviceIdentity.name(),
                    Instant.now(clock).truncatedTo(ChronoUnit.SECONDS)
            );

            if (!completionPublisher.send(job.id(), completionEvent)) {
                throw new TimeoutException(
                        "completion event " + completionEvent.path("eventId").asText() + " was not confirmed"
                );
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.failed();
            log.warn("interrupted while processing job {}; requesting redelivery", job.id());
            return ProcessingOutcome.rejectTransient(e);
        } catch (Exception e) {
            metrics.failed();
            log.warn("error processing job {}; requesting redelivery", job.id(), e);
            return ProcessingOutcome.rejectTransient(e);
        }

        metrics.completed(sample);
        log.info("job {} completed", job.id());

        return ProcessingOutcome.acknowledge();
    }

    private ProcessingOutcome quarantine(
            final JsonNode root,
            final ErrorKind errorKind,
            final String diagnostic,
            final DeliveryInfo delivery
    ) {
        metrics.validationFailed();
        log.warn("quarantining message: {}", diagnostic);

        try {
            deadLetterRouter.route(root, errorKind, diagnostic, delivery);
            return ProcessingOutcome.rejectPermanent(diagnostic);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.failed();
            return ProcessingOutcome.rejectTransient(e);
        } catch (Exception e) {
            // the quarantine record must not be lost: redeliver instead of dropping
            metrics.failed();
            log.warn("dead-letter publish failed; requesting redelivery", e);
            return ProcessingOutcome.rejectTransient(e);
        }
    }

    private JsonNode parse(final String body) {
        if (body == null) {
            return null;
        } else {
            try {
                final JsonNode root = objectMapper.readTree(body);
                return root == null || root.isMissingNode() ? null : root;
            } catch (JsonProcessingException e) {
                log.debug("message body is not JSON: {}", e.getOriginalMessage());
                return null;
            }
        }
    }

    private EventPayload bindPayload(final EventEnvelope envelope) throws JsonProcessingException {
        if (envelope.isJobEvent()) {
            return new EventPayload.JobPayload(objectMapper.treeToValue(envelope.payload(), JobRecord.class));
        } else {
            return new EventPayload.OpaquePayload(envelope.payload());
        }
    }
}
