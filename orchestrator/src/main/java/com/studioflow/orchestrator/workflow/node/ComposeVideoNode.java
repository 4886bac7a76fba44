package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Records what the final cut is made of. */
@Component
public class ComposeVideoNode implements StageNode {

    @Override
    public Stage stage() { return Stage.COMPOSE_VIDEO; }

    @Override
    public NodeResult run(Job job) {
        Map<String, Object> computed = job.getComputed();
        String video = ComputedDocument.string(computed, "final_video_ref");
        if (video == null) video = ComputedDocument.string(computed, "preview_video_ref");

        Map<String, Object> composition = new LinkedHashMap<>();
        composition.put("video_ref", video);
        composition.put("audio_ref", ComputedDocument.string(computed, "audio_master_ref"));
        composition.put("duration_ms", computed.get("audio_master_duration_ms"));
        composition.put("video_candidate_id", ComputedDocument.string(computed, "chosen_video_candidate_id"));
        composition.put("timed_lyrics_ref", ComputedDocument.string(computed, "timed_lyrics_ref"));
        composition.put("segment_plan", ComputedDocument.map(computed, "segment_plan"));

        job.patchComputed(Map.of("composition", composition));
        return NodeResult.advance(Stage.QC_VIDEO);
    }
}
