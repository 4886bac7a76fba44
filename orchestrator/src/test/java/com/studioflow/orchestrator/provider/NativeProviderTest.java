package com.studioflow.orchestrator.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.RunType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class NativeProviderTest {

    private final NativeProvider provider = new NativeProvider(new ObjectMapper());

    @Test
    void lyricsCandidate_variantsDiffer() {
        ProviderPoll first  = provider.generate(request(RunType.LYRICS_CANDIDATE, 0, Map.of("title", "Neon")));
        ProviderPoll second = provider.generate(request(RunType.LYRICS_CANDIDATE, 1, Map.of("title", "Neon")));

        assertThat(first.state()).isEqualTo(ProviderState.SUCCEEDED);
        assertThat((String) first.output().get("lyrics_text")).contains("Neon").contains("[Chorus]");
        assertThat(first.output().get("lyrics_text")).isNotEqualTo(second.output().get("lyrics_text"));
    }

    @Test
    void audioCandidate_returnsWavPayload() {
        ProviderPoll poll = provider.generate(request(RunType.AUDIO_CANDIDATE, 0, Map.of("duration_ms", 2000)));

        assertThat(poll.hasPayload()).isTrue();
        assertThat(poll.contentType()).isEqualTo("audio/wav");
        assertThat(new String(poll.payload(), 0, 4)).isEqualTo("RIFF");
        assertThat(poll.output()).containsEntry("duration_ms", 2000L);
    }

    @Test
    void bpmDetect_shortSongsRunFaster() {
        assertThat(NativeProvider.bpm(Map.of("duration_ms", 30_000))).containsEntry("bpm", 128);
        assertThat(NativeProvider.bpm(Map.of("duration_ms", 180_000))).containsEntry("bpm", 120);
    }

    @Test
    void segmentDetect_planCoversFirstThirtySeconds() {
        Map<String, Object> out = NativeProvider.segments(Map.of("duration_ms", 120_000));

        assertThat((List<?>) out.get("segments")).hasSize(4);
        @SuppressWarnings("unchecked")
        Map<String, Object> plan = (Map<String, Object>) out.get("segment_plan");
        assertThat(plan).containsEntry("start_ms", 0).containsEntry("end_ms", 30_000L);
    }

    @Test
    void submitThenPoll_returnsResultOnce() {
        String id = provider.submit(request(RunType.LYRICS_CANDIDATE, 0, Map.of()), "key-1");

        assertThat(provider.poll(id).state()).isEqualTo(ProviderState.SUCCEEDED);
        assertThat(provider.poll(id).state()).isEqualTo(ProviderState.FAILED);
    }

    private static ProviderRequest request(RunType type, int variant, Map<String, Object> params) {
        return new ProviderRequest(UUID.randomUUID(), type, variant, 1, params);
    }
}
