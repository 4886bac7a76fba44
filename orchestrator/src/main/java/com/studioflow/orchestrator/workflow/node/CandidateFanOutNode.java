package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.candidate.CandidateController;
import com.studioflow.orchestrator.model.CandidateType;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Starts a round of candidates of one type. The per-type policy (how many,
 * which providers, whether a human picks, what the providers are asked)
 * is supplied by {@link CandidateNodesConfig}.
 */
public class CandidateFanOutNode implements StageNode {

    private final Stage               stage;
    private final Stage               fanInStage;
    private final CandidateType       type;
    private final CandidateController controller;
    private final ToIntFunction<Job>  count;
    private final Function<Job, List<String>>         providers;
    private final Predicate<Job>                      hitl;
    private final Function<Job, Map<String, Object>>  params;

    public CandidateFanOutNode(Stage stage, Stage fanInStage, CandidateType type,
                               CandidateController controller,
                               ToIntFunction<Job> count,
                               Function<Job, List<String>> providers,
                               Predicate<Job> hitl,
                               Function<Job, Map<String, Object>> params) {
        this.stage      = stage;
        this.fanInStage = fanInStage;
        this.type       = type;
        this.controller = controller;
        this.count      = count;
        this.providers  = providers;
        this.hitl       = hitl;
        this.params     = params;
    }

    @Override
    public Stage stage() { return stage; }

    @Override
    public NodeResult run(Job job) {
        controller.fanOut(job, type, count.applyAsInt(job), providers.apply(job), hitl.test(job), params.apply(job));
        return NodeResult.advance(fanInStage);
    }
}
