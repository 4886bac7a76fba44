package com.studioflow.orchestrator.model;

import java.util.Locale;

/**
 * Named stages of the media pipeline with the progress percentage each one
 * reports. The allowed edges between them live in
 * {@link com.studioflow.orchestrator.workflow.StageGraph}.
 */
public enum Stage {
    INTENT("intent", 5),
    PLAN("plan", 15),
    INGEST_AUDIO("ingest_audio", 18),
    LYRICS_FANOUT("lyrics_fanout", 22),
    LYRICS_FANIN("lyrics_fanin", 30),
    ARRANGEMENT("arrangement", 38),
    BYO_ANALYSIS_FANOUT("byo_analysis_fanout", 40),
    PROVIDER_ROUTE("provider_route", 45),
    AUDIO_FANOUT("audio_fanout", 55),
    BYO_ANALYSIS_FANIN("byo_analysis_fanin", 55),
    AUDIO_FANIN("audio_fanin", 70),
    ALIGN_LYRICS("align_lyrics", 78),
    VIDEO_FANOUT("video_fanout", 85),
    VIDEO_FANIN("video_fanin", 92),
    COMPOSE_VIDEO("compose_video", 95),
    QC_VIDEO("qc_video", 98),
    PUBLISH_READY("publish_ready", 100);

    private final String code;
    private final int    progress;

    Stage(String code, int progress) {
        this.code     = code;
        this.progress = progress;
    }

    public String code()   { return code; }
    public int progress()  { return progress; }

    /** Unknown or missing stage codes start the job from the beginning. */
    public static Stage fromCode(String code) {
        if (code == null || code.isBlank()) return INTENT;
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Stage s : values()) {
            if (s.code.equals(normalized)) return s;
        }
        return INTENT;
    }
}
