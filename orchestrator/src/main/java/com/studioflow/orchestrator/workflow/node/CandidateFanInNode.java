package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.candidate.CandidateController;
import com.studioflow.orchestrator.candidate.FanInResult;
import com.studioflow.orchestrator.model.CandidateType;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import com.studioflow.orchestrator.workflow.WorkflowException;

/**
 * Maps a fan-in outcome onto the graph: wait, pause for a human, go back
 * to the fan-out for a retry, fail, or move on with the winner.
 */
public class CandidateFanInNode implements StageNode {

    public static final String EXHAUSTED_CODE = "CANDIDATES_EXHAUSTED";

    private final Stage               stage;
    private final Stage               fanOutStage;
    private final Stage               nextStage;
    private final CandidateType       type;
    private final CandidateController controller;

    public CandidateFanInNode(Stage stage, Stage fanOutStage, Stage nextStage,
                              CandidateType type, CandidateController controller) {
        this.stage       = stage;
        this.fanOutStage = fanOutStage;
        this.nextStage   = nextStage;
        this.type        = type;
        this.controller  = controller;
    }

    @Override
    public Stage stage() { return stage; }

    @Override
    public NodeResult run(Job job) {
        FanInResult result = controller.fanIn(job, type);
        return switch (result.outcome()) {
            case NO_GROUP, RETRY   -> NodeResult.advance(fanOutStage);
            case WAITING_PARALLEL  -> NodeResult.waitAt(stage);
            case ACTION_REQUIRED   -> NodeResult.pauseAt(stage);
            case CHOSEN            -> NodeResult.advance(nextStage);
            case EXHAUSTED         -> throw new WorkflowException(WorkflowException.Kind.EXHAUSTED, EXHAUSTED_CODE,
                    "every " + type.code() + " candidate failed on " + result.attempt() + " attempts");
        };
    }
}
