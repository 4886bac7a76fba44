package com.studioflow.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One unit of external work: a call to a provider that may take minutes.
 *
 * Rows are inserted by {@code ProviderRunQueue.enqueue} with an
 * insert-or-ignore on {@code idempotency_key}, claimed by workers via
 * SELECT FOR UPDATE SKIP LOCKED and never modified once terminal.
 *
 * DB table: provider_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "provider_runs")
public class ProviderRun {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(nullable = false, updatable = false)
    private String provider;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.CREATED;

    @Column(name = "run_type", nullable = false, updatable = false)
    private String runType;

    @Column(name = "group_id", updatable = false)
    private UUID groupId;

    // Set for candidate runs only.
    @Column(name = "candidate_id", updatable = false)
    private UUID candidateId;

    @Column(nullable = false, updatable = false)
    private int attempt = 1;

    @Column(name = "provider_job_id")
    private String providerJobId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> request = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> response;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> meta = new LinkedHashMap<>();

    @Column(name = "worker_id")
    private String workerId;

    @Version
    private Long version;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

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

    protected ProviderRun() {}   // required by JPA

    public ProviderRun(UUID id, UUID jobId, String provider, String idempotencyKey,
                       RunType runType, UUID groupId, UUID candidateId, int attempt,
                       Map<String, Object> request) {
        this.id             = id;
        this.jobId          = jobId;
        this.provider       = provider;
        this.idempotencyKey = idempotencyKey;
        this.runType        = runType.code();
        this.groupId        = groupId;
        this.candidateId    = candidateId;
        this.attempt        = attempt;
        this.request        = new LinkedHashMap<>(request);
    }

    public RunType runType() {
        return RunType.fromCode(runType);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()             { return id; }
    public UUID       getJobId()          { return jobId; }
    public String     getProvider()       { return provider; }
    public String     getIdempotencyKey() { return idempotencyKey; }
    public RunStatus  getStatus()         { return status; }
    public String     getRunType()        { return runType; }
    public UUID       getGroupId()        { return groupId; }
    public UUID       getCandidateId()    { return candidateId; }
    public int        getAttempt()        { return attempt; }
    public String     getProviderJobId()  { return providerJobId; }
    public String     getWorkerId()       { return workerId; }
    public Instant    getStartedAt()      { return startedAt; }
    public Instant    getFinishedAt()     { return finishedAt; }
    public Instant    getCreatedAt()      { return createdAt; }

    public Map<String, Object> getRequest()  { return request; }
    public Map<String, Object> getResponse() { return response; }
    public Map<String, Object> getMeta()     { return meta; }

    public void setStatus(RunStatus status)                 { this.status = status; }
    public void setProviderJobId(String providerJobId)      { this.providerJobId = providerJobId; }
    public void setResponse(Map<String, Object> response)   { this.response = response == null ? null : new LinkedHashMap<>(response); }
    public void setWorkerId(String workerId)                { this.workerId = workerId; }
    public void setStartedAt(Instant t)                     { this.startedAt = t; }
    public void setFinishedAt(Instant t)                    { this.finishedAt = t; }
    public void patchMeta(Map<String, Object> patch)        { this.meta = ComputedDocument.deepMerge(meta, patch); }
}
