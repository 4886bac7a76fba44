package com.studioflow.orchestrator.model;

/** Why a tick stopped advancing the graph. */
public enum StopReason {
    WAITING_PARALLEL("waiting_parallel"),
    ACTION_REQUIRED("action_required"),
    DONE("done");

    private final String code;

    StopReason(String code) { this.code = code; }

    public String code() { return code; }
}
