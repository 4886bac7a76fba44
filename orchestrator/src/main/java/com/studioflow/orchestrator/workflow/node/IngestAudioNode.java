package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.candidate.TrackWriter;
import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.model.TrackType;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Takes the uploaded recording as the job's full mix. Without one the job
 * pauses on {@code upload_audio}; resolving the action with
 * {@code audio_master_ref} continues it.
 */
@Component
public class IngestAudioNode implements StageNode {

    private final TrackWriter tracks;

    public IngestAudioNode(TrackWriter tracks) {
        this.tracks = tracks;
    }

    @Override
    public Stage stage() { return Stage.INGEST_AUDIO; }

    @Override
    public NodeResult run(Job job) {
        Map<String, Object> computed = job.getComputed();
        Map<String, Object> input    = job.getInput();

        String ref = ComputedDocument.string(computed, "audio_master_ref");
        if (ref == null) ref = ComputedDocument.string(input, "audio_url");
        if (ref == null) ref = ComputedDocument.string(ComputedDocument.map(input, "hints"), "audio_url");
        if (ref == null) {
            RequiredActions.raise(job, RequiredActions.UPLOAD_AUDIO, "Upload the song to continue");
            return NodeResult.pauseAt(Stage.INGEST_AUDIO);
        }

        int duration = ComputedDocument.integer(computed, "audio_master_duration_ms",
                ComputedDocument.integer(input, "duration_ms", 0));
        Long durationMs = duration > 0 ? (long) duration : null;

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("audio_master_ref", ref);
        patch.put("audio_master_duration_ms", durationMs);
        patch.put("audio_source", "upload");
        job.patchComputed(patch);
        tracks.upsert(job.getId(), TrackType.FULL_MIX, ref, durationMs, null, Map.of("source", "upload"));
        return NodeResult.advance(Stage.BYO_ANALYSIS_FANOUT);
    }
}
