package com.studioflow.orchestrator.model;

public enum CandidateStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CHOSEN,
    DISCARDED,
    ABANDONED;

    /** A group is complete once every member reports true here. */
    public boolean isTerminal() {
        return this != QUEUED && this != RUNNING;
    }
}
