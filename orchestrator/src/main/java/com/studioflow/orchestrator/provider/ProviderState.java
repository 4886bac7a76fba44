package com.studioflow.orchestrator.provider;

public enum ProviderState {
    PROCESSING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }
}
