package com.studioflow.orchestrator.repository;

import com.studioflow.orchestrator.model.ProviderRun;
import com.studioflow.orchestrator.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queue operations over the provider_runs table.
 */
public interface ProviderRunRepository extends JpaRepository<ProviderRun, UUID> {

    /**
     * Insert-or-ignore on idempotency_key: enqueueing the same logical run
     * twice leaves exactly one row. Returns the number of rows inserted.
     * Optional uuids are passed as strings, empty meaning null.
     */
    @Modifying
    @Query(value = """
            INSERT INTO provider_runs (id, job_id, provider, idempotency_key, status, run_type,
                                       group_id, candidate_id, attempt, request, meta,
                                       version, created_at, updated_at)
            VALUES (:id, :jobId, :provider, :key, 'CREATED', :runType,
                    CAST(NULLIF(:groupId, '') AS uuid), CAST(NULLIF(:candidateId, '') AS uuid), :attempt, CAST(:request AS jsonb), CAST(:meta AS jsonb),
                    0, now(), now())
            ON CONFLICT (idempotency_key) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("jobId") UUID jobId,
                       @Param("provider") String provider,
                       @Param("key") String idempotencyKey,
                       @Param("runType") String runType,
                       @Param("groupId") String groupId,
                       @Param("candidateId") String candidateId,
                       @Param("attempt") int attempt,
                       @Param("request") String requestJson,
                       @Param("meta") String metaJson);

    Optional<ProviderRun> findByIdempotencyKey(String idempotencyKey);

    /**
     * Lock the oldest CREATED run.
     *
     * SKIP LOCKED means a row already locked by another worker is skipped,
     * so concurrent claimers never block each other and never receive the
     * same run. The caller flips the row to RUNNING before committing.
     */
    @Query(value = """
            SELECT * FROM provider_runs
            WHERE status = 'CREATED'
            ORDER BY created_at ASC
            LIMIT 1
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    Optional<ProviderRun> lockNextCreated();

    /** Non-candidate runs of one type enqueued for a group. */
    List<ProviderRun> findByJobIdAndRunTypeAndGroupId(UUID jobId, String runType, UUID groupId);

    /** Runs RUNNING since before {@code cutoff}; their worker is presumed gone. */
    List<ProviderRun> findTop50ByStatusAndStartedAtBefore(RunStatus status, Instant cutoff);
}
