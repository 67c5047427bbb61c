package com.indigententerprises.applications.pipeline.infrastructure;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * observability counters of the processor, bound to whatever registry the caller owns.
 * <p>
 * rendered by a Prometheus registry as {@code processor_jobs_processed_total},
 * {@code processor_jobs_completed_total}, {@code processor_jobs_failed_total},
 * {@code processor_jobs_validation_failed_total} and {@code processor_job_processing_seconds}.
 */
public final class ProcessorMetrics {

    private final MeterRegistry registry;
    private final Counter processed;
    private final Counter completed;
    private final Counter failed;
    private final Counter validationFailed;
    private final Timer processingTime;

    public ProcessorMetrics(final MeterRegistry registry) {
        this.registry = registry;
        this.processed = Counter.builder("processor.jobs.processed")
                .description("Total jobs processed")
                .register(registry);
        this.completed = Counter.builder("processor.jobs.completed")
                .description("Total jobs successfully completed")
                .register(registry);
        this.failed = Counter.builder("processor.jobs.failed")
                .description("Total jobs failed")
                .register(registry);
        this.validationFailed = Counter.builder("processor.jobs.validation.failed")
                .description("Total messages rejected as unparseable or contract-violating")
                .register(registry);
        this.processingTime = Timer.builder("processor.job.processing")
                .description("Time spent processing job")
                .register(registry);
    }

    public Timer.Sample messageSeen() {
        processed.increment();
        return Timer.start(registry);
    }

    public void completed(final Timer.Sample sample) {
        completed.increment();
        sample.stop(processingTime);
    }

    public void failed() {
        failed.increment();
    }

    public void validationFailed() {
        validationFailed.increment();
    }

    public double processedCount() {
        return processed.count();
    }

    public double completedCount() {
        return completed.count();
    }

    public double failedCount() {
        return failed.count();
    }

    public double validationFailedCount() {
        return validationFailed.count();
    }

    public long processingTimeCount() {
        return processingTime.count();
    }
}
