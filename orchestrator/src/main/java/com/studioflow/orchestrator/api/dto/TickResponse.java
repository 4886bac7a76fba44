package com.studioflow.orchestrator.api.dto;

import com.studioflow.orchestrator.workflow.TickResult;

import java.util.UUID;

public record TickResponse(UUID jobId, String stageIn, String stageOut, String stopReason,
                           String status, int nodesRun) {

    public static TickResponse from(TickResult r) {
        return new TickResponse(
                r.jobId(),
                r.stageIn() == null ? null : r.stageIn().code(),
                r.stageOut() == null ? null : r.stageOut().code(),
                r.stopReason() == null ? null : r.stopReason().code(),
                r.status().name(),
                r.nodesRun()
        );
    }
}
