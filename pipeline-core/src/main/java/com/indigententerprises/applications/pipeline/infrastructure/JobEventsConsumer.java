package com.indigententerprises.applications.pipeline.infrastructure;

import com.indigententerprises.applications.pipeline.domain.DeliveryInfo;
import com.indigententerprises.applications.pipeline.domain.ProcessingOutcome;
import com.indigententerprises.applications.pipeline.serviceimplementations.JobPipelineOrchestrator;
import com.indigententerprises.applications.pipeline.serviceimplementations.OutcomeSettler;

import org.springframework.beans.BeansException;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * single-threaded consumer of the inbound job topic. one record is taken to its outcome and
 * settled before the next poll (the consumer must be configured with max.poll.records=1 and
 * auto-commit off).
 * <p>
 * per-record failures never leave this loop. transient ones back off exponentially, with no cap
 * on the number of redeliveries; anything escaping the loop itself stops the application.
 */
public final class JobEventsConsumer implements Runnable, ApplicationContextAware {

    private static final Logger log = LoggerFactory.getLogger(JobEventsConsumer.class);

    private final Consumer<String, String> consumer;
    private final JobPipelineOrchestrator orchestrator;
    private final String jobsCreatedTopic;
    private final long initialBackOffMillis;
    private final long maxBackOffMillis;
    private final Map<TopicPartition, Long> awaitingRedelivery;

    private ApplicationContext applicationContext;

    public JobEventsConsumer(
            final Consumer<String, String> consumer,
            final JobPipelineOrchestrator orchestrator,
            final String jobsCreatedTopic,
            final long initialBackOffMillis,
            final long maxBackOffMillis
    ) {
        this.consumer = consumer;
        this.orchestrator = orchestrator;
        this.jobsCreatedTopic = jobsCreatedTopic;
        this.initialBackOffMillis = initialBackOffMillis;
        this.maxBackOffMillis = maxBackOffMillis;
        this.awaitingRedelivery = new HashMap<>();
    }

    @Override
    public void setApplicationContext(final ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void run() {
        try {
            consumer.subscribe(Collections.singletonList(jobsCreatedTopic));
            log.info("consuming {}", jobsCreatedTopic);

            // mutable data
            long backOff = initialBackOffMillis;

            try {
                while (!Thread.currentThread().isInterrupted()) {
                    final ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(500));

                    for (final ConsumerRecord<String, String> record : records) {
                        final ProcessingOutcome outcome = deliver(record);

                        if (outcome instanceof ProcessingOutcome.RejectTransient) {
                            pause(backOff);
                            backOff = Math.min(maxBackOffMillis, Math.max(1L, backOff) * 2);
                            // the rest of the batch is fetched again after the seek
                            break;
                        } else {
                            backOff = initialBackOffMillis;
                        }
                    }
                }
            } catch (WakeupException ignored) {
                // shutdown
            } finally {
                consumer.close();
            }
        } catch (RuntimeException e) {
            log.error("unexpected error occurred during consumption", e);

            if (applicationContext != null) {
                SpringApplication.exit(applicationContext, () -> 1);
            }
            System.exit(1);
        }
    }

    public void shutdown() {
        consumer.wakeup();
    }

    ProcessingOutcome deliver(final ConsumerRecord<String, String> record) {
        final TopicPartition tp = new TopicPartition(record.topic(), record.partition());
        final boolean redelivered = Long.valueOf(record.offset()).equals(awaitingRedelivery.get(tp));
        final DeliveryInfo deliveryInfo =
                new DeliveryInfo(record.topic(), record.partition(), record.offset(), redelivered);

        final ProcessingOutcome outcome = orchestrator.handle(record.value(), deliveryInfo);
        OutcomeSettler.settle(outcome, new KafkaDelivery(consumer, tp, record.offset()));

        if (outcome instanceof ProcessingOutcome.RejectTransient) {
            awaitingRedelivery.put(tp, record.offset());
        } else {
            awaitingRedelivery.remove(tp);
        }

        return outcome;
    }

    private static void pause(final long millis) {
        if (millis > 0) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
