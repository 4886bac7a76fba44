package com.studioflow.orchestrator.workflow;

import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.model.StopReason;

/**
 * What a node decided: the stage the job moves to, and whether the tick
 * stops there. A null {@code stopReason} lets the router run the next node.
 */
public record NodeResult(Stage next, StopReason stopReason) {

    public static NodeResult advance(Stage next) {
        return new NodeResult(next, null);
    }

    public static NodeResult waitAt(Stage stage) {
        return new NodeResult(stage, StopReason.WAITING_PARALLEL);
    }

    public static NodeResult pauseAt(Stage stage) {
        return new NodeResult(stage, StopReason.ACTION_REQUIRED);
    }

    public static NodeResult done(Stage stage) {
        return new NodeResult(stage, StopReason.DONE);
    }
}
