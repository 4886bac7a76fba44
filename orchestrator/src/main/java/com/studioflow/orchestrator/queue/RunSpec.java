package com.studioflow.orchestrator.queue;

import com.studioflow.orchestrator.model.RunType;

import java.util.Map;
import java.util.UUID;

/** Everything needed to enqueue one provider run. */
public record RunSpec(
        UUID                jobId,
        String              provider,
        RunType             runType,
        UUID                groupId,
        UUID                candidateId,
        int                 attempt,
        Map<String, Object> request,
        Map<String, Object> meta
) {
    public RunSpec {
        request = request == null ? Map.of() : request;
        meta    = meta == null ? Map.of() : meta;
    }

    /** Key derived from the candidate for candidate runs, from the group otherwise. */
    public String idempotencyKey() {
        UUID target = candidateId != null ? candidateId : groupId;
        return IdempotencyKeys.forRun(jobId, runType, target, attempt);
    }
}
