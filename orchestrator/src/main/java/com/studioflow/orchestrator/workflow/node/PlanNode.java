package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobMode;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds the music plan and picks the route:
 * uploaded songs go to ingestion, uploaded lyrics skip the lyrics round,
 * everything else starts with lyric candidates.
 */
@Component
public class PlanNode implements StageNode {

    /** Input hints copied into computed so later stages read one place. */
    static final List<String> COPIED_HINTS = List.of(
            "audio_candidates_n", "video_candidates_n", "hitl_video_selection",
            "lyrics_providers", "audio_providers", "video_providers");

    static final int DEFAULT_DURATION_MS = 30_000;

    @Override
    public Stage stage() { return Stage.PLAN; }

    @Override
    public NodeResult run(Job job) {
        Map<String, Object> input = job.getInput();
        Map<String, Object> hints = ComputedDocument.map(input, "hints");

        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("title", ComputedDocument.string(input, "title"));
        plan.put("theme", ComputedDocument.string(input, "theme"));
        plan.put("mood", ComputedDocument.string(input, "mood"));
        plan.put("genre", ComputedDocument.string(input, "genre"));
        plan.put("duration_ms", ComputedDocument.integer(input, "duration_ms", DEFAULT_DURATION_MS));

        Map<String, Object> patch = new LinkedHashMap<>();
        String language = ComputedDocument.string(input, "language");
        patch.put("language_hint", language == null ? "en" : language);
        patch.put("music_plan", plan);
        for (String key : COPIED_HINTS) {
            if (hints.containsKey(key) && !job.getComputed().containsKey(key)) {
                patch.put(key, hints.get(key));
            }
        }

        if (job.getMode() == JobMode.BYO) {
            job.patchComputed(patch);
            return NodeResult.advance(Stage.INGEST_AUDIO);
        }
        String lyrics = ComputedDocument.string(input, "lyrics_text");
        if (lyrics != null) {
            patch.put("lyrics_text", lyrics);
            patch.put("lyrics_source", "upload");
            job.patchComputed(patch);
            return NodeResult.advance(Stage.ARRANGEMENT);
        }
        job.patchComputed(patch);
        return NodeResult.advance(Stage.LYRICS_FANOUT);
    }
}
