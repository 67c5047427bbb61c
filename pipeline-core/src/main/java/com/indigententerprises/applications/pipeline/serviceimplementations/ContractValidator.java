package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.domain.ContractValidation;
import com.indigententerprises.applications.pipeline.domain.ErrorKind;
import com.indigententerprises.applications.pipeline.domain.EventEnvelope;
import com.indigententerprises.applications.pipeline.serviceinterfaces.ConfigurationException;

import com.networknt.schema.Error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * validates an inbound message against the envelope contract and, for job.* events, its payload
 * against the job contract. the first failing stage short-circuits. never mutates its input.
 */
public final class ContractValidator {

    public static final String ENVELOPE_CONTRACT = "event-envelope";
    public static final String JOB_CONTRACT = "job";

    // keeps quarantine records bounded
    private static final int MAX_REPORTED_VIOLATIONS = 3;

    private final ContractRegistry registry;

    public ContractValidator(final ContractRegistry registry) throws ConfigurationException {
        for (final String name : List.of(ENVELOPE_CONTRACT, JOB_CONTRACT)) {
            if (!registry.contains(name)) {
                throw new ConfigurationException("contract not loaded: " + name);
            }
        }

        this.registry = registry;
    }

    public ContractValidation validate(final JsonNode event) {
        final ContractValidation envelopeResult = validateEnvelope(event);

        if (!envelopeResult.valid()) {
            return envelopeResult;
        } else {
            final JsonNode eventType = event.get("eventType");

            if (eventType != null && eventType.isTextual() && eventType.asText().startsWith(EventEnvelope.JOB_NAMESPACE)) {
                return validateJob(event.get("payload"));
            } else {
                return ContractValidation.ok();
            }
        }
    }

    public ContractValidation validateEnvelope(final JsonNode event) {
        final String violations = check(ENVELOPE_CONTRACT, event);

        if (violations == null) {
            return ContractValidation.ok();
        } else {
            return ContractValidation.fail(ErrorKind.ENVELOPE_INVALID, "Envelope validation failed: " + violations);
        }
    }

    public ContractValidation validateJob(final JsonNode job) {
        final String violations = check(JOB_CONTRACT, job);

        if (violations == null) {
            return ContractValidation.ok();
        } else {
            return ContractValidation.fail(ErrorKind.PAYLOAD_INVALID, "Payload validation failed: " + violations);
        }
    }

    private String check(final String contractName, final JsonNode instance) {
        final JsonNode subject = instance == null ? NullNode.getInstance() : instance;
        final List<Error> errors = registry.require(contractName).validate(subject);

        if (errors.isEmpty()) {
            return null;
        } else {
            return errors.stream()
                    .limit(MAX_REPORTED_VIOLATIONS)
                    .map(error -> error.getInstanceLocation() + ": " + error.getMessage())
                    .collect(Collectors.joining("; "));
        }
    }
}
