package com.studioflow.orchestrator.model;

/** Kinds of promoted media a graph job can own, one row each. */
public enum TrackType {
    FULL_MIX,
    TIMED_LYRICS,
    VIDEO
}
