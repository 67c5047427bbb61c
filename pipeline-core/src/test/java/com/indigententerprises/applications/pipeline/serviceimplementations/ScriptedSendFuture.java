package com.indigententerprises.applications.pipeline.serviceimplementations;

import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;

import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * stand-in for the future a producer send returns: either confirmed at once or never confirmed.
 */
public final class ScriptedSendFuture implements Future<RecordMetadata> {

    private final RecordMetadata recordMetadata;

    private ScriptedSendFuture(final RecordMetadata recordMetadata) {
        this.recordMetadata = recordMetadata;
    }

    public static ScriptedSendFuture confirmed(final String topic) {
        return new ScriptedSendFuture(new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, 0L, 4, 8));
    }

    public static ScriptedSendFuture neverConfirmed() {
        return new ScriptedSendFuture(null);
    }

    @Override
    public boolean cancel(final boolean mayInterruptIfRunning) {
        return false;
    }

    @Override
    public boolean isCancelled() {
        return false;
    }

    @Override
    public boolean isDone() {
        return recordMetadata != null;
    }

    @Override
    public RecordMetadata get() {
        return recordMetadata;
    }

    @Override
    public RecordMetadata get(final long timeout, final TimeUnit unit) throws TimeoutException {
        if (recordMetadata == null) {
            throw new TimeoutException("not confirmed within " + timeout + " " + unit);
        } else {
            return recordMetadata;
        }
    }
}
