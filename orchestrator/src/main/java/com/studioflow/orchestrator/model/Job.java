package com.studioflow.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One unit of durable work.
 *
 * Graph jobs ({@code kind = music_video}) are advanced stage by stage by the
 * router; every other kind is a single-stage job claimed and retried through
 * the lease columns ({@code attempt_count}, {@code next_run_at},
 * {@code lease_expires_at}).
 *
 * The {@code version} column is the compare-and-swap token for every write,
 * so two ticks racing on the same job cannot both commit a merge of
 * {@code computed}.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    public static final String KIND_MUSIC_VIDEO = "music_video";

    @Id
    private UUID id;

    @Column(nullable = false, updatable = false)
    private String kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobMode mode = JobMode.AUTOPILOT;

    // Null for single-stage jobs.
    @Enumerated(EnumType.STRING)
    private Stage stage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.QUEUED;

    @Column(nullable = false)
    private int progress = 0;

    // Immutable after creation.
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false, updatable = false)
    private Map<String, Object> input = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> computed = new LinkedHashMap<>();

    @Column(name = "error_code")
    private String errorCode;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "request_hash", nullable = false, updatable = false)
    private String requestHash;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 0;

    @Column(name = "max_tries", nullable = false)
    private int maxTries = 3;

    @Column(name = "next_run_at", nullable = false)
    private Instant nextRunAt = Instant.now();

    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "worker_id")
    private String workerId;

    @Version
    private Long version;

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

    protected Job() {}   // required by JPA

    public Job(UUID id, String kind, JobMode mode, Map<String, Object> input, String requestHash) {
        this.id          = id;
        this.kind        = kind;
        this.mode        = mode;
        this.input       = new LinkedHashMap<>(input);
        this.requestHash = requestHash;
        if (isGraphJob()) {
            this.stage = Stage.INTENT;
        }
    }

    // ------------------------------------------------------------------
    // Computed document
    // ------------------------------------------------------------------

    /** Deep-merges {@code patch} into {@code computed}; see {@link ComputedDocument}. */
    public void patchComputed(Map<String, Object> patch) {
        this.computed = ComputedDocument.deepMerge(computed, patch);
    }

    /** The pending human action, or null when the job is free to advance. */
    public Map<String, Object> getRequiredAction() {
        Object action = computed.get("required_action");
        if (action instanceof Map<?, ?> m && !m.isEmpty()) {
            return ComputedDocument.map(computed, "required_action");
        }
        return null;
    }

    public boolean isGraphJob() {
        return KIND_MUSIC_VIDEO.equals(kind);
    }

    public void fail(String code, String message) {
        this.status       = JobStatus.FAILED;
        this.errorCode    = code;
        this.errorMessage = message;
        this.leaseExpiresAt = null;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()             { return id; }
    public String     getKind()           { return kind; }
    public JobMode    getMode()           { return mode; }
    public Stage      getStage()          { return stage; }
    public JobStatus  getStatus()         { return status; }
    public int        getProgress()       { return progress; }
    public String     getErrorCode()      { return errorCode; }
    public String     getErrorMessage()   { return errorMessage; }
    public String     getRequestHash()    { return requestHash; }
    public int        getAttemptCount()   { return attemptCount; }
    public int        getMaxTries()       { return maxTries; }
    public Instant    getNextRunAt()      { return nextRunAt; }
    public Instant    getLeaseExpiresAt() { return leaseExpiresAt; }
    public String     getWorkerId()       { return workerId; }
    public Long       getVersion()        { return version; }
    public Instant    getCreatedAt()      { return createdAt; }
    public Instant    getUpdatedAt()      { return updatedAt; }

    public Map<String, Object> getInput()    { return input; }
    public Map<String, Object> getComputed() { return computed; }

    public void setStage(Stage stage)                  { this.stage = stage; }
    public void setStatus(JobStatus status)            { this.status = status; }
    public void setProgress(int progress)              { this.progress = progress; }
    public void setErrorCode(String errorCode)         { this.errorCode = errorCode; }
    public void setErrorMessage(String errorMessage)   { this.errorMessage = errorMessage; }
    public void setAttemptCount(int attemptCount)      { this.attemptCount = attemptCount; }
    public void setMaxTries(int maxTries)              { this.maxTries = maxTries; }
    public void setNextRunAt(Instant t)                { this.nextRunAt = t; }
    public void setLeaseExpiresAt(Instant t)           { this.leaseExpiresAt = t; }
    public void setWorkerId(String workerId)           { this.workerId = workerId; }
}
