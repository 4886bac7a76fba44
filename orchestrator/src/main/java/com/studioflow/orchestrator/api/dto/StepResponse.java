package com.studioflow.orchestrator.api.dto;

import com.studioflow.orchestrator.model.JobStep;

import java.time.Instant;
import java.util.Map;

/** Read-only view of a step log entry returned by GET /jobs/{id}/steps. */
public record StepResponse(
        String              stepCode,
        String              status,
        Map<String, Object> detail,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static StepResponse from(JobStep s) {
        return new StepResponse(
                s.getStepCode(),
                s.getStatus(),
                s.getDetail(),
                s.getCreatedAt(),
                s.getUpdatedAt()
        );
    }
}
