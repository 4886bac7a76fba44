package com.studioflow.orchestrator.repository;

import com.studioflow.orchestrator.model.Track;
import com.studioflow.orchestrator.model.TrackType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TrackRepository extends JpaRepository<Track, UUID> {

    Optional<Track> findByJobIdAndTrackType(UUID jobId, TrackType trackType);

    List<Track> findByJobId(UUID jobId);
}
