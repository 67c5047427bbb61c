package com.indigententerprises.applications.pipeline.serviceinterfaces;

import com.indigententerprises.applications.pipeline.domain.JobRecord;

@FunctionalInterface
public interface JobWork {
    void perform(final JobRecord job) throws JobExecutionException, InterruptedException;
}
