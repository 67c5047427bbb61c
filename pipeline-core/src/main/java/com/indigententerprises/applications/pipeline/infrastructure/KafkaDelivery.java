package com.indigententerprises.applications.pipeline.infrastructure;

import com.indigententerprises.applications.pipeline.serviceinterfaces.Delivery;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * acknowledgment over consumer offsets.
 * <ul>
 *   <li>ack, nack without requeue: commit offset + 1, the record leaves the active queue</li>
 *   <li>nack with requeue: seek back to the record so the next poll delivers it again</li>
 * </ul>
 */
public final class KafkaDelivery implements Delivery {

    private static final Logger log = LoggerFactory.getLogger(KafkaDelivery.class);

    private final Consumer<String, String> consumer;
    private final TopicPartition topicPartition;
    private final long offset;

    // mutable data
    private boolean settled;

    public KafkaDelivery(
            final Consumer<String, String> consumer,
            final TopicPartition topicPartition,
            final long offset
    ) {
        this.consumer = consumer;
        this.topicPartition = topicPartition;
        this.offset = offset;
        this.settled = false;
    }

    @Override
    public void ack() {
        markSettled();
        commit();
    }

    @Override
    public void nack(final boolean requeue) {
        markSettled();

        if (requeue) {
            consumer.seek(topicPartition, offset);
        } else {
            commit();
        }
    }

    private void markSettled() {
        if (settled) {
            throw new IllegalStateException("delivery " + topicPartition + "@" + offset + " already settled");
        } else {
            settled = true;
        }
    }

    private void commit() {
        try {
            consumer.commitSync(Map.of(topicPartition, new OffsetAndMetadata(offset + 1)));
        } catch (WakeupException e) {
            throw e;
        } catch (KafkaException e) {
            // uncommitted records come back after the next rebalance; at-least-once still holds
            log.warn("offset commit failed for {}@{}", topicPartition, offset, e);
        }
    }
}
