package com.indigententerprises.applications.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;

/**
 * job as carried in the payload of a job.* envelope.
 *
 * status stays a raw string here; only {@code JobStateMachine} decides whether it is a legal one.
 * an absent or null payload is an empty object.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRecord(
        String id,
        String type,
        String status,
        JsonNode payload,
        Instant createdAt,
        Instant updatedAt
) {
    public JobRecord {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            payload = JsonNodeFactory.instance.objectNode();
        }
    }
}
