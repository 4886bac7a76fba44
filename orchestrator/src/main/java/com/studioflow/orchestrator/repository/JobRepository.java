package com.studioflow.orchestrator.repository;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + claim queries for the jobs table.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Insert a job unless one with the same (kind, request_hash) exists.
     * Returns 1 when a row was inserted, 0 when the request was a duplicate.
     * An empty stage string stores null.
     */
    @Modifying
    @Query(value = """
            INSERT INTO jobs (id, kind, mode, stage, status, progress, input, computed,
                              request_hash, max_tries, next_run_at, version, created_at, updated_at)
            VALUES (:id, :kind, :mode, NULLIF(:stage, ''), 'QUEUED', 0, CAST(:input AS jsonb), '{}'::jsonb,
                    :requestHash, :maxTries, now(), 0, now(), now())
            ON CONFLICT (kind, request_hash) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("kind") String kind,
                       @Param("mode") String mode,
                       @Param("stage") String stage,
                       @Param("input") String inputJson,
                       @Param("requestHash") String requestHash,
                       @Param("maxTries") int maxTries);

    Optional<Job> findByKindAndRequestHash(String kind, String requestHash);

    /**
     * Lock up to {@code limit} runnable jobs of one kind, oldest first.
     *
     * FOR UPDATE SKIP LOCKED lets any number of workers call this at once:
     * a row locked by another claimer is skipped, never waited on. Must run
     * inside the transaction that flips the rows to RUNNING.
     */
    @Query(value = """
            SELECT * FROM jobs
            WHERE kind = :kind
              AND status = 'QUEUED'
              AND next_run_at <= :now
            ORDER BY created_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<Job> lockRunnable(@Param("kind") String kind,
                           @Param("now") Instant now,
                           @Param("limit") int limit);

    /** RUNNING leased jobs whose worker stopped renewing before {@code now}. */
    @Query(value = """
            SELECT * FROM jobs
            WHERE status = 'RUNNING'
              AND lease_expires_at IS NOT NULL
              AND lease_expires_at < :now
            ORDER BY lease_expires_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<Job> lockExpiredLeases(@Param("now") Instant now, @Param("limit") int limit);

    /** Jobs of one kind in the given statuses, least recently touched first. */
    @Query("""
            SELECT j.id FROM Job j
            WHERE j.kind = :kind AND j.status IN :statuses
            ORDER BY j.updatedAt ASC
            """)
    List<UUID> findIdsForSweep(@Param("kind") String kind,
                               @Param("statuses") Collection<JobStatus> statuses,
                               Pageable page);
}
