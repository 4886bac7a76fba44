package com.studioflow.orchestrator.workflow.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.blob.BlobStore;
import com.studioflow.orchestrator.candidate.TrackWriter;
import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.ProviderRun;
import com.studioflow.orchestrator.model.RunType;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.model.TrackType;
import com.studioflow.orchestrator.provider.NativeProvider;
import com.studioflow.orchestrator.queue.ProviderRunQueue;
import com.studioflow.orchestrator.queue.RunSpec;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import com.studioflow.orchestrator.workflow.StepLog;
import com.studioflow.orchestrator.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Word timing for the promoted lyrics against the master audio.
 *
 * Runs only when {@code timed_lyrics} is among the requested outputs.
 * A failed alignment is logged and skipped; the video does not need it.
 */
@Component
public class AlignLyricsNode implements StageNode {

    private static final Logger log = LoggerFactory.getLogger(AlignLyricsNode.class);

    static final String OUTPUT = "timed_lyrics";

    private final ProviderRunQueue runQueue;
    private final ProviderRuns     runs;
    private final TrackWriter      tracks;
    private final BlobStore        blobs;
    private final StepLog          stepLog;
    private final ObjectMapper     json;

    public AlignLyricsNode(ProviderRunQueue runQueue, ProviderRuns runs, TrackWriter tracks,
                           BlobStore blobs, StepLog stepLog, ObjectMapper objectMapper) {
        this.runQueue = runQueue;
        this.runs     = runs;
        this.tracks   = tracks;
        this.blobs    = blobs;
        this.stepLog  = stepLog;
        this.json     = objectMapper;
    }

    @Override
    public Stage stage() { return Stage.ALIGN_LYRICS; }

    @Override
    public NodeResult run(Job job) {
        Map<String, Object> computed = job.getComputed();
        List<String> outputs = ComputedDocument.strings(job.getInput(), "outputs");
        if (!outputs.contains(OUTPUT) || !ComputedDocument.map(computed, OUTPUT).isEmpty()) {
            return NodeResult.advance(Stage.VIDEO_FANOUT);
        }

        String gid = ComputedDocument.string(ComputedDocument.map(computed, "align_lyrics"), "group_id");
        if (gid == null) {
            return enqueue(job);
        }

        Optional<ProviderRun> run = runs.find(job.getId(), RunType.ALIGN_LYRICS, UUID.fromString(gid));
        if (!ProviderRuns.isDone(run)) {
            return NodeResult.waitAt(Stage.ALIGN_LYRICS);
        }
        Map<String, Object> timed = ComputedDocument.map(ProviderRuns.output(run), OUTPUT);
        if (timed.isEmpty()) {
            log.warn("Job {}: lyric alignment {} without a result, continuing without timed lyrics",
                    job.getId(), run.get().getStatus());
            stepLog.record(job.getId(), OUTPUT, StepLog.FAILED, Map.of("run_status", run.get().getStatus().name()));
            job.patchComputed(Map.of("align_lyrics", Map.of("status", "failed")));
            return NodeResult.advance(Stage.VIDEO_FANOUT);
        }

        String locator = blobs.put(toJson(timed), "application/json");
        Long duration = durationOf(computed);
        tracks.upsert(job.getId(), TrackType.TIMED_LYRICS, locator, duration, null,
                Map.of("segments", timed.get("segments") instanceof List<?> l ? l.size() : 0));
        job.patchComputed(Map.of(
                OUTPUT, timed,
                "timed_lyrics_ref", locator,
                "align_lyrics", Map.of("status", "succeeded")));
        stepLog.record(job.getId(), OUTPUT, StepLog.SUCCEEDED);
        return NodeResult.advance(Stage.VIDEO_FANOUT);
    }

    private NodeResult enqueue(Job job) {
        Map<String, Object> computed = job.getComputed();
        String lyrics = ComputedDocument.string(computed, "lyrics_text");
        if (lyrics == null) {
            RequiredActions.raise(job, RequiredActions.PROVIDE_LYRICS, "Provide lyrics to time against the song");
            return NodeResult.pauseAt(Stage.ALIGN_LYRICS);
        }
        String audio = ComputedDocument.string(computed, "audio_master_ref");
        if (audio == null) {
            RequiredActions.raise(job, RequiredActions.UPLOAD_AUDIO, "Upload the song to time the lyrics against");
            return NodeResult.pauseAt(Stage.ALIGN_LYRICS);
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("audio_ref", audio);
        request.put("duration_ms", durationOf(computed));
        request.put("lyrics_text", lyrics);
        request.put("language", ComputedDocument.string(computed, "language_hint"));

        UUID groupId = UUID.randomUUID();
        runQueue.enqueue(new RunSpec(job.getId(), NativeProvider.NAME, RunType.ALIGN_LYRICS, groupId, null, 1,
                request, Map.of()));
        job.patchComputed(Map.of("align_lyrics", Map.of("group_id", groupId.toString(), "status", "queued")));
        return NodeResult.waitAt(Stage.ALIGN_LYRICS);
    }

    private static Long durationOf(Map<String, Object> computed) {
        int d = ComputedDocument.integer(computed, "audio_master_duration_ms", 0);
        return d > 0 ? (long) d : null;
    }

    private byte[] toJson(Map<String, Object> value) {
        try {
            return json.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new WorkflowException(WorkflowException.Kind.PROVIDER, "BAD_TIMED_LYRICS",
                    "Timed lyrics are not serializable: " + e.getMessage());
        }
    }
}
