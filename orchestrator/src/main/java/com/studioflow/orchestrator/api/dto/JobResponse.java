package com.studioflow.orchestrator.api.dto;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Track;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Response body for POST /jobs and GET /jobs/{id}.
 * Track locators are replaced by signed, time-limited URLs.
 */
public record JobResponse(
        UUID                id,
        String              kind,
        String              mode,
        String              stage,
        String              status,
        int                 progress,
        Map<String, Object> requiredAction,
        String              errorCode,
        String              errorMessage,
        int                 attemptCount,
        List<TrackView>     tracks,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static JobResponse from(Job job, List<Track> tracks, UnaryOperator<String> signer) {
        return new JobResponse(
                job.getId(),
                job.getKind(),
                job.getMode().code(),
                job.getStage() == null ? null : job.getStage().code(),
                job.getStatus().name(),
                job.getProgress(),
                job.getRequiredAction(),
                job.getErrorCode(),
                job.getErrorMessage(),
                job.getAttemptCount(),
                tracks.stream().map(t -> TrackView.from(t, signer)).toList(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
