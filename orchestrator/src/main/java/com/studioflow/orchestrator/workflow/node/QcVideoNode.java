package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import com.studioflow.orchestrator.workflow.WorkflowException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

@Component
public class QcVideoNode implements StageNode {

    @Override
    public Stage stage() { return Stage.QC_VIDEO; }

    @Override
    public NodeResult run(Job job) {
        if (ComputedDocument.string(job.getComputed(), "final_video_ref") == null) {
            throw WorkflowException.noOutputs("no video was promoted for job " + job.getId());
        }
        job.patchComputed(Map.of("qc", Map.of("passed", true, "checked_at", Instant.now().toString())));
        return NodeResult.advance(Stage.PUBLISH_READY);
    }
}
