package com.indigententerprises.applications.pipeline.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * quarantine artifact for a message that can never succeed as-is. never retried automatically.
 *
 * originalEvent is the parsed message as received, or null when nothing could be parsed.
 */
public record DeadLetterRecord(
        JsonNode originalEvent,
        String error,
        String rejectedAt,
        String correlationId,
        String service,
        String serviceVersion
) {}
