package com.studioflow.orchestrator.candidate;

import com.studioflow.orchestrator.model.Candidate;
import com.studioflow.orchestrator.model.CandidateType;
import com.studioflow.orchestrator.model.Job;

import java.util.Map;

/**
 * Copies a chosen candidate's output into the job's durable state.
 *
 * Runs inside the selection transaction. Implementations may write
 * side rows (tracks) and return the patch to deep-merge into
 * {@code computed}.
 */
public interface CandidatePromotion {

    CandidateType type();

    Map<String, Object> promote(Job job, Candidate winner);
}
