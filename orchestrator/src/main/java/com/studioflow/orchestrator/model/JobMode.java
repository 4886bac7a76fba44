package com.studioflow.orchestrator.model;

import java.util.Locale;

/**
 * How a graph job treats candidate groups.
 *
 * CO_CREATE pauses every fan-in for a human pick, BYO starts from an
 * uploaded recording, AUTOPILOT picks winners by score.
 */
public enum JobMode {
    AUTOPILOT("autopilot"),
    CO_CREATE("co_create"),
    BYO("byo");

    private final String code;

    JobMode(String code) { this.code = code; }

    public String code() { return code; }

    public boolean isHumanInTheLoop() { return this == CO_CREATE; }

    /** Blank or null means autopilot; unknown codes are rejected. */
    public static JobMode fromCode(String code) {
        if (code == null || code.isBlank()) return AUTOPILOT;
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (JobMode m : values()) {
            if (m.code.equals(normalized)) return m;
        }
        throw new IllegalArgumentException("Unknown job mode: " + code);
    }
}
