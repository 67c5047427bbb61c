package com.indigententerprises.applications.pipeline.serviceinterfaces;

import com.indigententerprises.applications.pipeline.domain.JobRecord;
import com.indigententerprises.applications.pipeline.domain.JobStatus;

/**
 * sole writer of job rows. implementations throw unchecked data-access exceptions; callers treat
 * every one of them as transient.
 */
public interface JobStore {

    /**
     * insert on first sight; on conflict update status, payload and updated timestamp, unless the
     * stored job is already COMPLETED or FAILED.
     *
     * @return false when the stored job is terminal and nothing was written
     */
    boolean upsert(final JobRecord job, final JobStatus status);

    void updateStatus(final String jobId, final JobStatus status);
}
