package com.studioflow.orchestrator.api.dto;

import com.studioflow.orchestrator.model.Track;

import java.util.UUID;
import java.util.function.UnaryOperator;

public record TrackView(String type, String url, Long durationMs, UUID candidateId) {

    public static TrackView from(Track t, UnaryOperator<String> signer) {
        return new TrackView(
                t.getTrackType().name(),
                t.getLocator() == null ? null : signer.apply(t.getLocator()),
                t.getDurationMs(),
                t.getCandidateId()
        );
    }
}
