package com.studioflow.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Output of a single-stage job. A succeeded job without any artifact row
 * fails the post-run sanity check.
 *
 * DB table: artifacts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "artifacts")
public class Artifact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(nullable = false)
    private String kind;

    @Column(nullable = false)
    private String locator;

    @Column(name = "content_type")
    private String contentType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Artifact() {}   // required by JPA

    public Artifact(UUID jobId, String kind, String locator, String contentType, long sizeBytes) {
        this.jobId       = jobId;
        this.kind        = kind;
        this.locator     = locator;
        this.contentType = contentType;
        this.sizeBytes   = sizeBytes;
    }

    public UUID    getId()          { return id; }
    public UUID    getJobId()       { return jobId; }
    public String  getKind()        { return kind; }
    public String  getLocator()     { return locator; }
    public String  getContentType() { return contentType; }
    public long    getSizeBytes()   { return sizeBytes; }
    public Instant getCreatedAt()   { return createdAt; }
}
