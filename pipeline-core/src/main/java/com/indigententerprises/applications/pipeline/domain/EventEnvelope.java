package com.indigententerprises.applications.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.UUID;

/**
 * unit of transport on every topic this pipeline touches.
 *
 * correlationId and idempotencyKey identify the causal chain and are carried unchanged into
 * derived events; eventId identifies this one event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventEnvelope(
        String contractVersion,
        String eventType,
        String eventId,
        Instant occurredAt,
        String correlationId,
        String idempotencyKey,
        EventProducer producer,
        JsonNode payload
) {
    public static final String JOB_NAMESPACE = "job.";
    public static final String JOB_COMPLETED = "job.completed";

    @JsonIgnore
    public boolean isJobEvent() {
        return eventType != null && eventType.startsWith(JOB_NAMESPACE);
    }

    /**
     * derives the completion event from the envelope as received, so fields this record does not
     * model travel through untouched. only eventType, eventId, occurredAt and producer.service
     * change; the inbound tree is not modified.
     */
    public static ObjectNode toCompletionEvent(
            final ObjectNode inbound,
            final String serviceName,
            final Instant publishedAt
    ) {
        final ObjectNode result = inbound.deepCopy();
        result.put("eventType", JOB_COMPLETED);
        result.put("eventId", UUID.randomUUID().toString());
        result.put("occurredAt", publishedAt.toString());

        final JsonNode producer = result.get("producer");

        if (producer instanceof ObjectNode producerNode) {
            producerNode.put("service", serviceName);
        }

        return result;
    }
}
