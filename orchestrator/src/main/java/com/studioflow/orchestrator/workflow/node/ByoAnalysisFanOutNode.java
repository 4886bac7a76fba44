package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.RunType;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.provider.NativeProvider;
import com.studioflow.orchestrator.queue.ProviderRunQueue;
import com.studioflow.orchestrator.queue.RunSpec;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Starts BPM and segment detection on the uploaded recording, in parallel. */
@Component
public class ByoAnalysisFanOutNode implements StageNode {

    static final List<RunType> ANALYSES = List.of(RunType.BYO_BPM_DETECT, RunType.BYO_SEGMENT_DETECT);

    private final ProviderRunQueue runQueue;

    public ByoAnalysisFanOutNode(ProviderRunQueue runQueue) {
        this.runQueue = runQueue;
    }

    @Override
    public Stage stage() { return Stage.BYO_ANALYSIS_FANOUT; }

    @Override
    public NodeResult run(Job job) {
        Map<String, Object> computed = job.getComputed();
        if (ComputedDocument.string(ComputedDocument.map(computed, "byo_analysis"), "group_id") != null) {
            return NodeResult.advance(Stage.BYO_ANALYSIS_FANIN);
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("audio_ref", ComputedDocument.string(computed, "audio_master_ref"));
        request.put("duration_ms", ComputedDocument.integer(computed, "audio_master_duration_ms", 0));

        UUID groupId = UUID.randomUUID();
        for (RunType type : ANALYSES) {
            runQueue.enqueue(new RunSpec(job.getId(), NativeProvider.NAME, type, groupId, null, 1,
                    request, Map.of()));
        }
        job.patchComputed(Map.of("byo_analysis", Map.of("group_id", groupId.toString())));
        return NodeResult.advance(Stage.BYO_ANALYSIS_FANIN);
    }
}
