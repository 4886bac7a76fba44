package com.studioflow.orchestrator.workflow;

import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.model.StopReason;

import java.util.UUID;

/**
 * Outcome of one tick. {@code stopReason} is null when the step budget ran
 * out before any node asked to stop; the next trigger continues from
 * {@code stageOut}.
 */
public record TickResult(UUID jobId, Stage stageIn, Stage stageOut, StopReason stopReason,
                         JobStatus status, int nodesRun) {
}
