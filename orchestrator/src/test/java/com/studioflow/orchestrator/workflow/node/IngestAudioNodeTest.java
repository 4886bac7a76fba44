package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.candidate.TrackWriter;
import com.studioflow.orchestrator.model.*;
import com.studioflow.orchestrator.workflow.NodeResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestAudioNodeTest {

    @Mock TrackWriter tracks;

    @Test
    void noUpload_pausesOnUploadAction() {
        Job job = job(Map.of("title", "t"));

        NodeResult result = new IngestAudioNode(tracks).run(job);

        assertThat(result.next()).isEqualTo(Stage.INGEST_AUDIO);
        assertThat(result.stopReason()).isEqualTo(StopReason.ACTION_REQUIRED);
        assertThat(job.getRequiredAction()).containsEntry("type", "upload_audio");
        verify(tracks, never()).upsert(any(), any(), any(), any(), any(), any());
    }

    @Test
    void resolvedUpload_becomesFullMix() {
        Job job = job(Map.of("title", "t"));
        job.patchComputed(Map.of("audio_master_ref", "blob://ab/song.wav", "audio_master_duration_ms", 42_000));

        NodeResult result = new IngestAudioNode(tracks).run(job);

        assertThat(result.next()).isEqualTo(Stage.BYO_ANALYSIS_FANOUT);
        assertThat(job.getComputed()).containsEntry("audio_source", "upload");
        verify(tracks).upsert(eq(job.getId()), eq(TrackType.FULL_MIX), eq("blob://ab/song.wav"),
                eq(42_000L), isNull(), any());
    }

    @Test
    void inputAudioUrl_usedWhenNothingComputed() {
        Job job = job(Map.of("title", "t", "audio_url", "https://cdn.example/song.mp3"));

        new IngestAudioNode(tracks).run(job);

        assertThat(job.getComputed()).containsEntry("audio_master_ref", "https://cdn.example/song.mp3");
    }

    private static Job job(Map<String, Object> input) {
        return new Job(UUID.randomUUID(), Job.KIND_MUSIC_VIDEO, JobMode.BYO, input, "h");
    }
}
