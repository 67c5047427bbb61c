package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.domain.JobRecord;
import com.indigententerprises.applications.pipeline.serviceinterfaces.JobWork;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public final class SimulatedJobWork implements JobWork {

    private static final Logger log = LoggerFactory.getLogger(SimulatedJobWork.class);

    private final Duration duration;

    public SimulatedJobWork(final Duration duration) {
        this.duration = duration;
    }

    @Override
    public void perform(final JobRecord job) throws InterruptedException {
        log.info("processing job {} of type {}", job.id(), job.type());

        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    }
}
