package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.domain.JobRecord;
import com.indigententerprises.applications.pipeline.domain.JobStatus;
import com.indigententerprises.applications.pipeline.repositories.JobRepository;

import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class JobPersistenceService
        implements com.indigententerprises.applications.pipeline.serviceinterfaces.JobStore {

    private final ObjectMapper objectMapper;
    private final JobRepository jobRepository;

    public JobPersistenceService(
            final ObjectMapper objectMapper,
            final JobRepository jobRepository
    ) {
        this.objectMapper = objectMapper;
        this.jobRepository = jobRepository;
    }

    @Override
    @Transactional
    public boolean upsert(final JobRecord job, final JobStatus status) {
        final String payloadJson;

        try {
            payloadJson = objectMapper.writeValueAsString(job.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload of job " + job.id() + " cannot be serialized", e);
        }

        final int written = jobRepository.upsert(job.id(), job.type(), status.name(), payloadJson, job.createdAt());
        return written > 0;
    }

    @Override
    @Transactional
    public void updateStatus(final String jobId, final JobStatus status) {
        final int updated = jobRepository.updateStatus(jobId, status.name());

        if (updated == 0) {
            throw new IllegalStateException("no row for job " + jobId);
        }
    }
}
