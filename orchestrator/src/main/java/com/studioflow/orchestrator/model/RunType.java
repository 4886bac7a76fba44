package com.studioflow.orchestrator.model;

import java.util.Locale;

/**
 * What a provider run produces. Candidate runs feed exactly one candidate;
 * the others store their result on the run itself and are read back by the
 * stage that enqueued them.
 */
public enum RunType {
    LYRICS_CANDIDATE("lyrics_candidate", CandidateType.LYRICS),
    AUDIO_CANDIDATE("audio_candidate", CandidateType.AUDIO),
    VIDEO_CANDIDATE("video_candidate", CandidateType.VIDEO),
    ALIGN_LYRICS("align_lyrics", null),
    BYO_BPM_DETECT("byo_bpm_detect", null),
    BYO_SEGMENT_DETECT("byo_segment_detect", null);

    private final String        code;
    private final CandidateType candidateType;

    RunType(String code, CandidateType candidateType) {
        this.code          = code;
        this.candidateType = candidateType;
    }

    public String code()                  { return code; }
    public CandidateType candidateType()  { return candidateType; }
    public boolean isCandidateRun()       { return candidateType != null; }

    public static RunType fromCode(String code) {
        String normalized = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        for (RunType t : values()) {
            if (t.code.equals(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown run type: " + code);
    }
}
