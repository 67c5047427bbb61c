package com.indigententerprises.applications.pipeline.repositories;

import com.indigententerprises.applications.pipeline.domain.JobEntity;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface JobRepository extends JpaRepository<JobEntity, String> {
    @Modifying
    @Query(value = """
            INSERT INTO jobs (id, type, status, payload, created_at, updated_at)
            VALUES (:id, :type, :status, CAST(:payload AS jsonb), :createdAt, now())
            ON CONFLICT (id) DO UPDATE
               SET status = EXCLUDED.status,
                   payload = EXCLUDED.payload,
                   updated_at = now()
             WHERE jobs.status NOT IN ('COMPLETED', 'FAILED')
           """, nativeQuery = true)
    int upsert(
            @Param("id") String id,
            @Param("type") String type,
            @Param("status") String status,
            @Param("payload") String payload,
            @Param("createdAt") Instant createdAt
    );

    @Modifying
    @Query(value = """
            UPDATE jobs
               SET status = :status,
                   updated_at = now()
             WHERE id = :id
           """, nativeQuery = true)
    int updateStatus(
            @Param("id") String id,
            @Param("status") String status
    );
}
