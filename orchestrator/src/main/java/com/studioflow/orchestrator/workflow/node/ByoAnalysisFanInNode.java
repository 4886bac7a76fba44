package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.ProviderRun;
import com.studioflow.orchestrator.model.RunType;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Waits for both analyses and merges them into computed. A failed
 * analysis is replaced by defaults; the song still continues.
 */
@Component
public class ByoAnalysisFanInNode implements StageNode {

    private static final Logger log = LoggerFactory.getLogger(ByoAnalysisFanInNode.class);

    static final int DEFAULT_BPM       = 120;
    static final int FALLBACK_PLAN_MS  = 30_000;

    private final ProviderRuns runs;

    public ByoAnalysisFanInNode(ProviderRuns runs) {
        this.runs = runs;
    }

    @Override
    public Stage stage() { return Stage.BYO_ANALYSIS_FANIN; }

    @Override
    public NodeResult run(Job job) {
        String gid = ComputedDocument.string(ComputedDocument.map(job.getComputed(), "byo_analysis"), "group_id");
        if (gid == null) {
            return NodeResult.advance(Stage.BYO_ANALYSIS_FANOUT);
        }
        UUID groupId = UUID.fromString(gid);
        Optional<ProviderRun> bpmRun = runs.find(job.getId(), RunType.BYO_BPM_DETECT, groupId);
        Optional<ProviderRun> segRun = runs.find(job.getId(), RunType.BYO_SEGMENT_DETECT, groupId);
        if (!ProviderRuns.isDone(bpmRun) || !ProviderRuns.isDone(segRun)) {
            return NodeResult.waitAt(Stage.BYO_ANALYSIS_FANIN);
        }

        Map<String, Object> bpm = ProviderRuns.output(bpmRun);
        Map<String, Object> seg = ProviderRuns.output(segRun);
        if (bpm.isEmpty() || seg.isEmpty()) {
            log.warn("Job {}: audio analysis incomplete (bpm={}, segments={}), using defaults",
                    job.getId(), bpmRun.get().getStatus(), segRun.get().getStatus());
        }

        int duration = ComputedDocument.integer(job.getComputed(), "audio_master_duration_ms", 0);
        Map<String, Object> plan = ComputedDocument.map(seg, "segment_plan");
        if (plan.isEmpty()) {
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("kind", "fallback_first_30s");
            fallback.put("start_ms", 0);
            fallback.put("end_ms", duration > 0 ? Math.min(duration, FALLBACK_PLAN_MS) : FALLBACK_PLAN_MS);
            plan = fallback;
        }

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("bpm", ComputedDocument.integer(bpm, "bpm", DEFAULT_BPM));
        patch.put("beat_grid", ComputedDocument.map(bpm, "beat_grid"));
        patch.put("segments", seg.getOrDefault("segments", List.of()));
        patch.put("segment_plan", plan);
        patch.put("byo_analysis", Map.of("status", bpm.isEmpty() || seg.isEmpty() ? "partial" : "complete"));
        job.patchComputed(patch);
        return NodeResult.advance(Stage.ALIGN_LYRICS);
    }
}
