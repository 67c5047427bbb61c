package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.domain.DeadLetterRecord;
import com.indigententerprises.applications.pipeline.domain.DeliveryInfo;
import com.indigententerprises.applications.pipeline.domain.ErrorKind;
import com.indigententerprises.applications.pipeline.domain.ServiceIdentity;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * builds quarantine records and publishes them to the dead-letter topic.
 *
 * the producer is expected to be durable (acks=all, idempotent); every publish blocks until the
 * broker confirms, so the source delivery is only resolved after the record is safe.
 */
public final class DeadLetterRouter {

    public static final String UNKNOWN_CORRELATION_ID = "unknown";

    private final ObjectMapper objectMapper;
    private final KafkaProducer<String, String> producer;
    private final String dltTopic;
    private final ServiceIdentity serviceIdentity;
    private final Clock clock;
    private final long timeoutInMillis;

    public DeadLetterRouter(
            final ObjectMapper objectMapper,
            final KafkaProducer<String, String> producer,
            final String dltTopic,
            final ServiceIdentity serviceIdentity,
            final Clock clock,
            final long timeoutInMillis
    ) {
        this.objectMapper = objectMapper;
        this.producer = producer;
        this.dltTopic = dltTopic;
        this.serviceIdentity = serviceIdentity;
        this.clock = clock;
        this.timeoutInMillis = timeoutInMillis;
    }

    public DeadLetterRecord route(
            final JsonNode originalEvent,
            final ErrorKind errorKind,
            final String diagnostic,
            final DeliveryInfo source
    ) throws JsonProcessingException, ExecutionException, InterruptedException, TimeoutException {
        final DeadLetterRecord deadLetter = build(originalEvent, diagnostic);
        final String json = objectMapper.writeValueAsString(deadLetter);
        final ProducerRecord<String, String> record =
                new ProducerRecord<>(dltTopic, recordKey(originalEvent), json);

        record.headers().add("dlt.errorKind", errorKind.name().getBytes(StandardCharsets.UTF_8));
        record.headers().add("dlt.errorDetail", diagnostic.getBytes(StandardCharsets.UTF_8));
        record.headers().add("dlt.sourceTopic", source.topic().getBytes(StandardCharsets.UTF_8));
        record.headers().add("dlt.sourcePartition", Integer.toString(source.partition()).getBytes(StandardCharsets.UTF_8));
        record.headers().add("dlt.sourceOffset", Long.toString(source.deliveryTag()).getBytes(StandardCharsets.UTF_8));

        final Future<RecordMetadata> future = producer.send(record);
        future.get(timeoutInMillis, TimeUnit.MILLISECONDS);

        return deadLetter;
    }

    public DeadLetterRecord build(final JsonNode originalEvent, final String diagnostic) {
        return new DeadLetterRecord(
                originalEvent,
                diagnostic,
                Instant.now(clock).toString(),
                extractCorrelationId(originalEvent),
                serviceIdentity.name(),
                serviceIdentity.version()
        );
    }

    /**
     * never fails, whatever shape the message has.
     */
    public static String extractCorrelationId(final JsonNode event) {
        if (event == null || !event.isObject()) {
            return UNKNOWN_CORRELATION_ID;
        } else {
            final JsonNode correlationId = event.get("correlationId");

            if (correlationId == null || !correlationId.isTextual() || correlationId.asText().isBlank()) {
                return UNKNOWN_CORRELATION_ID;
            } else {
                return correlationId.asText();
            }
        }
    }

    // job id when the payload carries one, else the event id, else no key
    private static String recordKey(final JsonNode event) {
        if (event == null || !event.isObject()) {
            return null;
        } else {
            final JsonNode jobId = event.path("payload").path("id");

            if (jobId.isTextual()) {
                return jobId.asText();
            } else {
                final JsonNode eventId = event.path("eventId");
                return eventId.isTextual() ? eventId.asText() : null;
            }
        }
    }
}
