package com.studioflow.orchestrator.model;

import java.util.Locale;

public enum CandidateType {
    LYRICS("lyrics"),
    AUDIO("audio"),
    VIDEO("video");

    private final String code;

    CandidateType(String code) { this.code = code; }

    public String code() { return code; }

    /** Provider run type used for one candidate of this type. */
    public RunType runType() {
        return switch (this) {
            case LYRICS -> RunType.LYRICS_CANDIDATE;
            case AUDIO  -> RunType.AUDIO_CANDIDATE;
            case VIDEO  -> RunType.VIDEO_CANDIDATE;
        };
    }

    /** Type of the human action raised when a group of this type needs a pick. */
    public String selectActionType() {
        return "select_" + code;
    }

    public static CandidateType fromCode(String code) {
        String normalized = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        for (CandidateType t : values()) {
            if (t.code.equals(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown candidate type: " + code);
    }
}
