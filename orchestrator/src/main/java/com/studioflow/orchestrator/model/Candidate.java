package com.studioflow.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One parallel attempt inside a candidate group.
 *
 * The id is assigned on construction so the provider run's idempotency key
 * can be derived before the row is flushed.
 *
 * DB table: candidates  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "candidates")
public class Candidate {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "candidate_type", nullable = false, updatable = false)
    private CandidateType candidateType;

    @Column(name = "group_id", nullable = false, updatable = false)
    private UUID groupId;

    @Column(name = "variant_index", nullable = false, updatable = false)
    private int variantIndex;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CandidateStatus status = CandidateStatus.QUEUED;

    @Column(nullable = false)
    private String provider;

    @Column(name = "provider_run_id")
    private UUID providerRunId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> content = new LinkedHashMap<>();

    // {"overall": 0.0..1.0, ...}
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> score = new LinkedHashMap<>();

    // Blob store locator, never the bytes.
    @Column(name = "media_ref")
    private String mediaRef;

    @Column(name = "duration_ms")
    private Long durationMs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> meta = new LinkedHashMap<>();

    @Version
    private Long version;

    @Column(name = "chosen_at")
    private Instant chosenAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Candidate() {}   // required by JPA

    public Candidate(UUID jobId, CandidateType type, UUID groupId,
                     int variantIndex, int attempt, String provider) {
        this.id            = UUID.randomUUID();
        this.jobId         = jobId;
        this.candidateType = type;
        this.groupId       = groupId;
        this.variantIndex  = variantIndex;
        this.attempt       = attempt;
        this.provider      = provider;
    }

    /** Score used by auto-selection; missing or unparseable counts as 0.0. */
    public double overallScore() {
        return ComputedDocument.decimal(score, "overall", 0.0);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID            getId()            { return id; }
    public UUID            getJobId()         { return jobId; }
    public CandidateType   getCandidateType() { return candidateType; }
    public UUID            getGroupId()       { return groupId; }
    public int             getVariantIndex()  { return variantIndex; }
    public int             getAttempt()       { return attempt; }
    public CandidateStatus getStatus()        { return status; }
    public String          getProvider()      { return provider; }
    public UUID            getProviderRunId() { return providerRunId; }
    public String          getMediaRef()      { return mediaRef; }
    public Long            getDurationMs()    { return durationMs; }
    public Instant         getChosenAt()      { return chosenAt; }
    public Instant         getCreatedAt()     { return createdAt; }
    public Instant         getUpdatedAt()     { return updatedAt; }

    public Map<String, Object> getContent()   { return content; }
    public Map<String, Object> getScore()     { return score; }
    public Map<String, Object> getMeta()      { return meta; }

    public void setStatus(CandidateStatus status)           { this.status = status; }
    public void setProviderRunId(UUID providerRunId)        { this.providerRunId = providerRunId; }
    public void setContent(Map<String, Object> content)     { this.content = new LinkedHashMap<>(content); }
    public void setScore(Map<String, Object> score)         { this.score = new LinkedHashMap<>(score); }
    public void setMediaRef(String mediaRef)                { this.mediaRef = mediaRef; }
    public void setDurationMs(Long durationMs)              { this.durationMs = durationMs; }
    public void setChosenAt(Instant chosenAt)               { this.chosenAt = chosenAt; }
    public void patchMeta(Map<String, Object> patch)        { this.meta = ComputedDocument.deepMerge(meta, patch); }
}
