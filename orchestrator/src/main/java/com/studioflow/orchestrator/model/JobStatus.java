package com.studioflow.orchestrator.model;

/**
 * Lifecycle of a job row.
 *
 * Graph jobs go QUEUED -> RUNNING on their first tick and stay RUNNING until
 * publish or failure. Leased single-stage jobs bounce between QUEUED and
 * RUNNING while they are retried with backoff.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
