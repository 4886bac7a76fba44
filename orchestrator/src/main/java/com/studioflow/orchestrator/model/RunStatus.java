package com.studioflow.orchestrator.model;

public enum RunStatus {
    CREATED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    ABANDONED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ABANDONED;
    }
}
