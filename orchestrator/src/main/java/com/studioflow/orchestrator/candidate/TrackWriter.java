package com.studioflow.orchestrator.candidate;

import com.studioflow.orchestrator.model.Track;
import com.studioflow.orchestrator.model.TrackType;
import com.studioflow.orchestrator.repository.TrackRepository;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/** Upserts the single track of a given type owned by a job. */
@Component
public class TrackWriter {

    private final TrackRepository trackRepo;

    public TrackWriter(TrackRepository trackRepo) {
        this.trackRepo = trackRepo;
    }

    public Track upsert(UUID jobId, TrackType type, String locator, Long durationMs,
                        UUID candidateId, Map<String, Object> meta) {
        Track track = trackRepo.findByJobIdAndTrackType(jobId, type)
                .orElseGet(() -> new Track(jobId, type));
        track.setLocator(locator);
        track.setDurationMs(durationMs);
        track.setCandidateId(candidateId);
        track.setMeta(meta == null ? Map.of() : meta);
        return trackRepo.save(track);
    }
}
