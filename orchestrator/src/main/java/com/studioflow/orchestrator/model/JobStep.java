package com.studioflow.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Step log entry: the last known status of one stage of one job.
 * Written with an upsert on (job_id, step_code) and read only by humans.
 *
 * DB table: job_steps  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_steps")
public class JobStep {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "step_code", nullable = false)
    private String stepCode;

    @Column(nullable = false)
    private String status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected JobStep() {}   // required by JPA

    public UUID    getId()        { return id; }
    public UUID    getJobId()     { return jobId; }
    public String  getStepCode()  { return stepCode; }
    public String  getStatus()    { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Map<String, Object> getDetail() { return detail; }
}
