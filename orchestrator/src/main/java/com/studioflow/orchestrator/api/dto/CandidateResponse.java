package com.studioflow.orchestrator.api.dto;

import com.studioflow.orchestrator.model.Candidate;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/** Read-only view of a candidate returned by GET /jobs/{id}/candidates. */
public record CandidateResponse(
        UUID                id,
        String              type,
        UUID                groupId,
        int                 variantIndex,
        int                 attempt,
        String              status,
        String              provider,
        double              score,
        Map<String, Object> content,
        String              mediaUrl,
        Long                durationMs,
        Instant             chosenAt
) {
    public static CandidateResponse from(Candidate c, UnaryOperator<String> signer) {
        return new CandidateResponse(
                c.getId(),
                c.getCandidateType().code(),
                c.getGroupId(),
                c.getVariantIndex(),
                c.getAttempt(),
                c.getStatus().name(),
                c.getProvider(),
                c.overallScore(),
                c.getContent(),
                c.getMediaRef() == null ? null : signer.apply(c.getMediaRef()),
                c.getDurationMs(),
                c.getChosenAt()
        );
    }
}
