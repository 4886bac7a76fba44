package com.studioflow.orchestrator.repository;

import com.studioflow.orchestrator.model.JobStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface JobStepRepository extends JpaRepository<JobStep, UUID> {

    /** Upsert on (job_id, step_code); detail is merged shallowly into the existing row. */
    @Modifying
    @Query(value = """
            INSERT INTO job_steps (id, job_id, step_code, status, detail, created_at, updated_at)
            VALUES (:id, :jobId, :stepCode, :status, CAST(:detail AS jsonb), now(), now())
            ON CONFLICT (job_id, step_code) DO UPDATE
               SET status     = EXCLUDED.status,
                   detail     = job_steps.detail || EXCLUDED.detail,
                   updated_at = now()
            """, nativeQuery = true)
    int upsert(@Param("id") UUID id,
               @Param("jobId") UUID jobId,
               @Param("stepCode") String stepCode,
               @Param("status") String status,
               @Param("detail") String detailJson);

    List<JobStep> findByJobIdOrderByCreatedAtAsc(UUID jobId);
}
