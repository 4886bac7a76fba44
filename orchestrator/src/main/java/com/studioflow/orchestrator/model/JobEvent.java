package com.studioflow.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Outbox row: "something happened to job X, tick it".
 *
 * Written in the same transaction as the state change it announces and
 * consumed by the outbox dispatcher, so a lost in-process notification
 * only delays the job until the next dispatch.
 *
 * DB table: job_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_events")
public class JobEvent {

    public static final String PROVIDER_RUN_DONE  = "provider_run_done";
    public static final String CANDIDATE_SELECTED = "candidate_selected";
    public static final String ACTION_RESOLVED    = "action_resolved";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false, updatable = false)
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Column(nullable = false)
    private int attempts = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "processed_at")
    private Instant processedAt;

    protected JobEvent() {}   // required by JPA

    public JobEvent(UUID jobId, String eventType, Map<String, Object> payload) {
        this.jobId     = jobId;
        this.eventType = eventType;
        this.payload   = new LinkedHashMap<>(payload);
    }

    public UUID     getId()          { return id; }
    public UUID     getJobId()       { return jobId; }
    public String   getEventType()   { return eventType; }
    public int      getAttempts()    { return attempts; }
    public Instant  getCreatedAt()   { return createdAt; }
    public Instant  getProcessedAt() { return processedAt; }
    public Map<String, Object> getPayload() { return payload; }

    public void incrementAttempts()           { this.attempts++; }
    public void setProcessedAt(Instant t)     { this.processedAt = t; }
}
