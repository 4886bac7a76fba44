package com.studioflow.orchestrator.lease;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.repository.ArtifactRepository;
import com.studioflow.orchestrator.repository.JobRepository;
import com.studioflow.orchestrator.service.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Claim / retry lifecycle of single-stage jobs.
 *
 * All public methods are @Transactional so that the SKIP LOCKED select and
 * the flip to RUNNING commit together.
 */
@Service
public class JobLeaseService {

    private static final Logger log = LoggerFactory.getLogger(JobLeaseService.class);

    public static final String PROCESSING_INCOMPLETE = "PROCESSING_INCOMPLETE";
    public static final String NO_OUTPUTS            = "NO_OUTPUTS";
    public static final String LEASE_EXPIRED         = "LEASE_EXPIRED";

    private final JobRepository      jobRepo;
    private final ArtifactRepository artifactRepo;
    private final Duration           lease;

    public JobLeaseService(JobRepository jobRepo,
                           ArtifactRepository artifactRepo,
                           @Value("${studioflow.lease.duration-sec:600}") long leaseSeconds) {
        this.jobRepo      = jobRepo;
        this.artifactRepo = artifactRepo;
        this.lease        = Duration.ofSeconds(leaseSeconds);
    }

    // ------------------------------------------------------------------
    // Claim
    // ------------------------------------------------------------------

    /**
     * Claim up to {@code limit} due QUEUED jobs of one kind, oldest first.
     * Each claimed job is RUNNING with its attempt counted and a lease set.
     */
    @Transactional
    public List<UUID> claimNextJobs(String kind, int limit, String workerId) {
        if (limit <= 0) return List.of();
        Instant now = Instant.now();
        List<Job> jobs = jobRepo.lockRunnable(kind, now, limit);
        for (Job job : jobs) {
            job.setStatus(JobStatus.RUNNING);
            job.setAttemptCount(job.getAttemptCount() + 1);
            job.setLeaseExpiresAt(now.plus(lease));
            job.setWorkerId(workerId);
        }
        jobRepo.saveAll(jobs);
        if (!jobs.isEmpty()) {
            log.info("Worker '{}' claimed {} {} job(s)", workerId, jobs.size(), kind);
        }
        return jobs.stream().map(Job::getId).toList();
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    /** Put the job back in the queue, due after {@code delay}. */
    @Transactional
    public void reschedule(UUID jobId, Duration delay, String code, String message) {
        Job job = load(jobId);
        requeue(job, delay, code, message);
        jobRepo.save(job);
    }

    /**
     * Retry with backoff while attempts remain, otherwise fail for good.
     * Ignored for jobs that already finished.
     */
    @Transactional
    public void handleFailure(UUID jobId, String code, String message) {
        Job job = load(jobId);
        if (job.getStatus().isTerminal()) {
            log.info("Job {} already {}, ignoring failure {}", jobId, job.getStatus(), code);
            return;
        }
        retryOrFail(job, code, message);
        jobRepo.save(job);
    }

    @Transactional
    public void markSucceeded(UUID jobId) {
        Job job = load(jobId);
        job.setStatus(JobStatus.SUCCEEDED);
        job.setProgress(100);
        job.setLeaseExpiresAt(null);
        job.setErrorCode(null);
        job.setErrorMessage(null);
        jobRepo.save(job);
    }

    /** Fail without retry, for errors another attempt cannot fix. */
    @Transactional
    public void failPermanently(UUID jobId, String code, String message) {
        Job job = load(jobId);
        job.fail(code, message);
        jobRepo.save(job);
        log.warn("Job {} failed permanently: {} {}", jobId, code, message);
    }

    /**
     * Sanity check after a handler returned: a job still RUNNING was never
     * finished, a SUCCEEDED job without artifacts produced nothing. Both go
     * through the retry rule.
     */
    @Transactional
    public void verifyOutcome(UUID jobId) {
        Job job = load(jobId);
        if (job.getStatus() == JobStatus.RUNNING) {
            retryOrFail(job, PROCESSING_INCOMPLETE, "handler returned without finishing the job");
            jobRepo.save(job);
        } else if (job.getStatus() == JobStatus.SUCCEEDED && artifactRepo.countByJobId(jobId) == 0) {
            retryOrFail(job, NO_OUTPUTS, "job succeeded without any artifact");
            jobRepo.save(job);
        }
    }

    /**
     * Requeue (or fail) RUNNING jobs whose lease ran out, up to
     * {@code limit} per call.
     *
     * @return the number of jobs touched
     */
    @Transactional
    public int expireLeases(int limit) {
        List<Job> expired = jobRepo.lockExpiredLeases(Instant.now(), limit);
        for (Job job : expired) {
            retryOrFail(job, LEASE_EXPIRED,
                    "lease of worker " + job.getWorkerId() + " expired at " + job.getLeaseExpiresAt());
        }
        jobRepo.saveAll(expired);
        return expired.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void retryOrFail(Job job, String code, String message) {
        if (job.getAttemptCount() < job.getMaxTries()) {
            Duration delay = Backoff.delayFor(job.getAttemptCount());
            requeue(job, delay, code, message);
            log.warn("Job {} attempt {}/{} failed ({}), retrying in {}s",
                    job.getId(), job.getAttemptCount(), job.getMaxTries(), code, delay.toSeconds());
        } else {
            job.fail(code, message);
            job.setWorkerId(null);
            log.error("Job {} failed after {} attempts: {} {}", job.getId(), job.getAttemptCount(), code, message);
        }
    }

    private static void requeue(Job job, Duration delay, String code, String message) {
        job.setStatus(JobStatus.QUEUED);
        job.setNextRunAt(Instant.now().plus(delay));
        job.setErrorCode(code);
        job.setErrorMessage(message);
        job.setLeaseExpiresAt(null);
        job.setWorkerId(null);
    }

    private Job load(UUID jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
