package com.studioflow.orchestrator.repository;

import com.studioflow.orchestrator.model.Artifact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ArtifactRepository extends JpaRepository<Artifact, UUID> {

    long countByJobId(UUID jobId);

    List<Artifact> findByJobId(UUID jobId);
}
