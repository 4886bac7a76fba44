package com.studioflow.orchestrator.candidate;

import java.util.UUID;

public record FanInResult(FanInOutcome outcome, UUID groupId, int attempt, UUID chosenCandidateId) {

    static FanInResult of(FanInOutcome outcome, UUID groupId, int attempt) {
        return new FanInResult(outcome, groupId, attempt, null);
    }

    static FanInResult chosen(UUID groupId, int attempt, UUID candidateId) {
        return new FanInResult(FanInOutcome.CHOSEN, groupId, attempt, candidateId);
    }
}
