package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobMode;
import com.studioflow.orchestrator.model.Stage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PlanNodeTest {

    private final PlanNode node = new PlanNode();

    @Test
    void autopilotWithoutLyrics_startsLyricsRound() {
        Job job = job(JobMode.AUTOPILOT, Map.of("title", "t", "mood", "dreamy"));

        assertThat(node.run(job).next()).isEqualTo(Stage.LYRICS_FANOUT);
        assertThat(job.getComputed()).containsEntry("language_hint", "en");
        assertThat(ComputedDocument.map(job.getComputed(), "music_plan"))
                .containsEntry("mood", "dreamy")
                .containsEntry("duration_ms", 30_000);
    }

    @Test
    void uploadedLyrics_skipToArrangement() {
        Job job = job(JobMode.CO_CREATE, Map.of("title", "t", "lyrics_text", "line one\nline two"));

        assertThat(node.run(job).next()).isEqualTo(Stage.ARRANGEMENT);
        assertThat(job.getComputed())
                .containsEntry("lyrics_text", "line one\nline two")
                .containsEntry("lyrics_source", "upload");
    }

    @Test
    void byoMode_goesToIngestion() {
        Job job = job(JobMode.BYO, Map.of("title", "t", "lyrics_text", "ignored here"));

        assertThat(node.run(job).next()).isEqualTo(Stage.INGEST_AUDIO);
        assertThat(job.getComputed()).doesNotContainKey("lyrics_source");
    }

    @Test
    void hints_copiedOnlyWhenNotAlreadyComputed() {
        Job job = job(JobMode.AUTOPILOT, Map.of("title", "t",
                "hints", Map.of("audio_candidates_n", 3, "video_providers", List.of("remote"))));
        job.patchComputed(Map.of("audio_candidates_n", 1));

        node.run(job);

        assertThat(job.getComputed())
                .containsEntry("audio_candidates_n", 1)
                .containsEntry("video_providers", List.of("remote"));
    }

    private static Job job(JobMode mode, Map<String, Object> input) {
        return new Job(UUID.randomUUID(), Job.KIND_MUSIC_VIDEO, mode, input, "h");
    }
}
