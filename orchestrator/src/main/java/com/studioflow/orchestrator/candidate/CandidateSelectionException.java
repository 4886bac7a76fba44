package com.studioflow.orchestrator.candidate;

/**
 * A candidate cannot be chosen: it belongs to another job or group, it is
 * not in a selectable status, or the job is not waiting for this pick.
 */
public class CandidateSelectionException extends RuntimeException {

    public CandidateSelectionException(String message) {
        super(message);
    }
}
