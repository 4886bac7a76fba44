package com.studioflow.orchestrator.repository;

import com.studioflow.orchestrator.model.Candidate;
import com.studioflow.orchestrator.model.CandidateType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CandidateRepository extends JpaRepository<Candidate, UUID> {

    /** All members of one fan-out round, in variant order. */
    List<Candidate> findByJobIdAndCandidateTypeAndGroupIdAndAttemptOrderByVariantIndexAsc(
            UUID jobId, CandidateType type, UUID groupId, int attempt);

    /** Every member of a group regardless of attempt, used by selection. */
    List<Candidate> findByGroupIdOrderByVariantIndexAsc(UUID groupId);

    List<Candidate> findByJobIdOrderByCreatedAtAsc(UUID jobId);

    List<Candidate> findByJobIdAndCandidateTypeOrderByCreatedAtAsc(UUID jobId, CandidateType type);
}
