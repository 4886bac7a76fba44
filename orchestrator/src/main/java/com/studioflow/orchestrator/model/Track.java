package com.studioflow.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Promoted media owned by a graph job. One row per (job, track type);
 * promotion of a new winner overwrites it.
 *
 * DB table: tracks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tracks")
public class Track {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "track_type", nullable = false, updatable = false)
    private TrackType trackType;

    private String locator;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "candidate_id")
    private UUID candidateId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> meta = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Track() {}   // required by JPA

    public Track(UUID jobId, TrackType trackType) {
        this.jobId     = jobId;
        this.trackType = trackType;
    }

    public UUID       getId()          { return id; }
    public UUID       getJobId()       { return jobId; }
    public TrackType  getTrackType()   { return trackType; }
    public String     getLocator()     { return locator; }
    public Long       getDurationMs()  { return durationMs; }
    public UUID       getCandidateId() { return candidateId; }
    public Map<String, Object> getMeta() { return meta; }

    public void setLocator(String locator)              { this.locator = locator; }
    public void setDurationMs(Long durationMs)          { this.durationMs = durationMs; }
    public void setCandidateId(UUID candidateId)        { this.candidateId = candidateId; }
    public void setMeta(Map<String, Object> meta)       { this.meta = new LinkedHashMap<>(meta); }
}
