package com.indigententerprises.applications.pipeline.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * payload of an envelope, keyed by the event type namespace.
 */
public sealed interface EventPayload permits EventPayload.JobPayload, EventPayload.OpaquePayload {

    record JobPayload(JobRecord job) implements EventPayload {}

    /** anything outside the job. namespace; carried along untouched */
    record OpaquePayload(JsonNode content) implements EventPayload {}
}
