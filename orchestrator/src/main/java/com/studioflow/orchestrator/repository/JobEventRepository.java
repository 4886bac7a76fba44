package com.studioflow.orchestrator.repository;

import com.studioflow.orchestrator.model.JobEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface JobEventRepository extends JpaRepository<JobEvent, UUID> {

    /** Unprocessed events, oldest first, skipping rows another dispatcher holds. */
    @Query(value = """
            SELECT * FROM job_events
            WHERE processed_at IS NULL
            ORDER BY created_at ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<JobEvent> lockPending(@Param("limit") int limit);
}
