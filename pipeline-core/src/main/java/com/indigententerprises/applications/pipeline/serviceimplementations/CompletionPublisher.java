package com.indigententerprises.applications.pipeline.serviceimplementations;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * synchronous transmission of completion events: send returns only once the broker has answered
 * or the timeout has passed.
 */
public final class CompletionPublisher {

    private final ObjectMapper objectMapper;
    private final KafkaProducer<String, String> producer;
    private final String completedTopic;
    private final long timeoutInMillis;

    public CompletionPublisher(
            final ObjectMapper objectMapper,
            final KafkaProducer<String, String> producer,
            final String completedTopic,
            final long timeoutInMillis) {
        this.objectMapper = objectMapper;
        this.producer = producer;
        this.completedTopic = completedTopic;
        this.timeoutInMillis = timeoutInMillis;
    }

    public boolean send(
            final String key,
            final JsonNode completionEvent
    ) throws JsonProcessingException, InterruptedException, ExecutionException {
        final String jsonOutput = objectMapper.writeValueAsString(completionEvent);
        final Future<RecordMetadata> sendFuture =
                producer.send(new ProducerRecord<>(completedTopic, key, jsonOutput));

        try {
            sendFuture.get(timeoutInMillis, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException | CancellationException e) {
            return false;
        }
    }
}
