package com.studioflow.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /jobs.
 *
 * Required: input (for music videos at least {@code title})
 * Optional: kind (defaults to music_video), mode (autopilot | co_create | byo),
 *   requestHash (defaults to a hash of the canonical request; resubmitting
 *   the same hash returns the existing job)
 */
public record CreateJobRequest(String kind, String mode, String requestHash, Map<String, Object> input) {

    public CreateJobRequest {
        if (input == null) input = Map.of();
    }
}
