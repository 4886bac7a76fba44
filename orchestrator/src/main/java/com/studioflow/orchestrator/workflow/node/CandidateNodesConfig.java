package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.candidate.CandidateController;
import com.studioflow.orchestrator.model.CandidateType;
import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.provider.ProviderRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The three candidate rounds of the pipeline.
 *
 * Counts: lyrics are fixed by configuration; audio and video honour the
 * {@code <type>_candidates_n} hint, clamped to 1..3 and 1..4.
 * Co-create jobs pick lyrics and audio by hand; video only when
 * {@code hitl_video_selection} is set as well.
 */
@Configuration
public class CandidateNodesConfig {

    static final int MAX_AUDIO_CANDIDATES = 3;
    static final int MAX_VIDEO_CANDIDATES = 4;

    private final CandidateController controller;
    private final ProviderRegistry    registry;

    public CandidateNodesConfig(CandidateController controller, ProviderRegistry registry) {
        this.controller = controller;
        this.registry   = registry;
    }

    // ------------------------------------------------------------------
    // Lyrics
    // ------------------------------------------------------------------

    @Bean
    CandidateFanOutNode lyricsFanOutNode(@Value("${studioflow.workflow.candidates.lyrics:3}") int lyricsCount) {
        return new CandidateFanOutNode(Stage.LYRICS_FANOUT, Stage.LYRICS_FANIN, CandidateType.LYRICS, controller,
                job -> lyricsCount,
                job -> ProviderChoice.resolve(job, "lyrics_providers", registry),
                job -> job.getMode().isHumanInTheLoop(),
                CandidateNodesConfig::lyricsParams);
    }

    @Bean
    CandidateFanInNode lyricsFanInNode() {
        return new CandidateFanInNode(Stage.LYRICS_FANIN, Stage.LYRICS_FANOUT, Stage.ARRANGEMENT,
                CandidateType.LYRICS, controller);
    }

    // ------------------------------------------------------------------
    // Audio
    // ------------------------------------------------------------------

    @Bean
    CandidateFanOutNode audioFanOutNode(@Value("${studioflow.workflow.candidates.audio:2}") int audioCount) {
        return new CandidateFanOutNode(Stage.AUDIO_FANOUT, Stage.AUDIO_FANIN, CandidateType.AUDIO, controller,
                job -> clamp(ComputedDocument.integer(job.getComputed(), "audio_candidates_n", audioCount),
                        MAX_AUDIO_CANDIDATES),
                job -> ProviderChoice.resolve(job, "audio_providers", registry),
                job -> job.getMode().isHumanInTheLoop(),
                CandidateNodesConfig::audioParams);
    }

    @Bean
    CandidateFanInNode audioFanInNode() {
        return new CandidateFanInNode(Stage.AUDIO_FANIN, Stage.AUDIO_FANOUT, Stage.ALIGN_LYRICS,
                CandidateType.AUDIO, controller);
    }

    // ------------------------------------------------------------------
    // Video
    // ------------------------------------------------------------------

    @Bean
    CandidateFanOutNode videoFanOutNode(@Value("${studioflow.workflow.candidates.video:3}") int videoCount) {
        return new CandidateFanOutNode(Stage.VIDEO_FANOUT, Stage.VIDEO_FANIN, CandidateType.VIDEO, controller,
                job -> clamp(ComputedDocument.integer(job.getComputed(), "video_candidates_n", videoCount),
                        MAX_VIDEO_CANDIDATES),
                job -> ProviderChoice.resolve(job, "video_providers", registry),
                job -> job.getMode().isHumanInTheLoop()
                        && ComputedDocument.flag(job.getComputed(), "hitl_video_selection"),
                CandidateNodesConfig::videoParams);
    }

    @Bean
    CandidateFanInNode videoFanInNode() {
        return new CandidateFanInNode(Stage.VIDEO_FANIN, Stage.VIDEO_FANOUT, Stage.COMPOSE_VIDEO,
                CandidateType.VIDEO, controller);
    }

    // ------------------------------------------------------------------
    // Provider parameters
    // ------------------------------------------------------------------

    static Map<String, Object> lyricsParams(Job job) {
        Map<String, Object> plan = ComputedDocument.map(job.getComputed(), "music_plan");
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("title", plan.get("title"));
        p.put("theme", plan.get("theme"));
        p.put("mood", plan.get("mood"));
        p.put("language", ComputedDocument.string(job.getComputed(), "language_hint"));
        return p;
    }

    static Map<String, Object> audioParams(Job job) {
        Map<String, Object> computed = job.getComputed();
        Map<String, Object> plan = ComputedDocument.map(computed, "music_plan");
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("title", plan.get("title"));
        p.put("genre", plan.get("genre"));
        p.put("mood", plan.get("mood"));
        p.put("duration_ms", plan.get("duration_ms"));
        p.put("lyrics_text", ComputedDocument.string(computed, "lyrics_text"));
        p.put("sections", ComputedDocument.map(computed, "arrangement").get("sections"));
        return p;
    }

    static Map<String, Object> videoParams(Job job) {
        Map<String, Object> computed = job.getComputed();
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("title", ComputedDocument.map(computed, "music_plan").get("title"));
        p.put("audio_ref", ComputedDocument.string(computed, "audio_master_ref"));
        p.put("duration_ms", computed.get("audio_master_duration_ms"));
        p.put("video_style", ComputedDocument.string(ComputedDocument.map(job.getInput(), "hints"), "video_style"));
        p.put("has_timed_lyrics", !ComputedDocument.map(computed, "timed_lyrics").isEmpty());
        return p;
    }

    static int clamp(int requested, int max) {
        return Math.max(1, Math.min(max, requested));
    }
}
