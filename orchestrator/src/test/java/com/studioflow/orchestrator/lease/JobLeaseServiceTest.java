package com.studioflow.orchestrator.lease;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobMode;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.repository.ArtifactRepository;
import com.studioflow.orchestrator.repository.JobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JobLeaseServiceTest {

    @Mock JobRepository      jobRepo;
    @Mock ArtifactRepository artifactRepo;

    private JobLeaseService leases;
    private Job job;

    @BeforeEach
    void setUp() {
        leases = new JobLeaseService(jobRepo, artifactRepo, 600);
        job = new Job(UUID.randomUUID(), TtsJobHandler.KIND, JobMode.AUTOPILOT, Map.of("text", "hi"), "h");
        job.setMaxTries(3);
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
    }

    @Test
    void claimNextJobs_setsLeaseAndCountsAttempt() {
        when(jobRepo.lockRunnable(eq("tts"), any(), eq(2))).thenReturn(List.of(job));

        List<UUID> claimed = leases.claimNextJobs("tts", 2, "jobs-1");

        assertThat(claimed).containsExactly(job.getId());
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getAttemptCount()).isEqualTo(1);
        assertThat(job.getWorkerId()).isEqualTo("jobs-1");
        assertThat(job.getLeaseExpiresAt()).isAfter(Instant.now().plusSeconds(590));
    }

    @Test
    void claimNextJobs_zeroLimit_claimsNothing() {
        assertThat(leases.claimNextJobs("tts", 0, "jobs-1")).isEmpty();
        verify(jobRepo, never()).lockRunnable(any(), any(), anyInt());
    }

    @Test
    void handleFailure_attemptsLeft_requeuesWithBackoff() {
        running(1);
        Instant before = Instant.now();

        leases.handleFailure(job.getId(), "WORKER_ERROR", "boom");

        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getErrorCode()).isEqualTo("WORKER_ERROR");
        assertThat(job.getLeaseExpiresAt()).isNull();
        assertThat(job.getNextRunAt()).isAfterOrEqualTo(before.plusSeconds(5));
        verify(jobRepo).save(job);
    }

    @Test
    void handleFailure_atMaxTries_failsJob() {
        running(3);

        leases.handleFailure(job.getId(), "WORKER_ERROR", "boom");

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorCode()).isEqualTo("WORKER_ERROR");
    }

    @Test
    void handleFailure_terminalJob_ignored() {
        job.setStatus(JobStatus.SUCCEEDED);

        leases.handleFailure(job.getId(), "WORKER_ERROR", "late");

        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        verify(jobRepo, never()).save(any());
    }

    @Test
    void verifyOutcome_stillRunning_isProcessingIncomplete() {
        running(1);

        leases.verifyOutcome(job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getErrorCode()).isEqualTo(JobLeaseService.PROCESSING_INCOMPLETE);
    }

    @Test
    void verifyOutcome_succeededWithoutArtifacts_isNoOutputs() {
        running(3);
        job.setStatus(JobStatus.SUCCEEDED);
        when(artifactRepo.countByJobId(job.getId())).thenReturn(0L);

        leases.verifyOutcome(job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorCode()).isEqualTo(JobLeaseService.NO_OUTPUTS);
    }

    @Test
    void verifyOutcome_succeededWithArtifacts_untouched() {
        job.setStatus(JobStatus.SUCCEEDED);
        when(artifactRepo.countByJobId(job.getId())).thenReturn(1L);

        leases.verifyOutcome(job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        verify(jobRepo, never()).save(any());
    }

    @Test
    void reschedule_putsJobBackWithDelay() {
        running(1);
        Instant before = Instant.now();

        leases.reschedule(job.getId(), Duration.ofMinutes(2), "RATE_LIMITED", "slow down");

        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getNextRunAt()).isAfterOrEqualTo(before.plusSeconds(120));
    }

    @Test
    void expireLeases_requeuesExpiredJobs() {
        running(1);
        when(jobRepo.lockExpiredLeases(any(), eq(10))).thenReturn(List.of(job));

        int touched = leases.expireLeases(10);

        assertThat(touched).isEqualTo(1);
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getErrorCode()).isEqualTo(JobLeaseService.LEASE_EXPIRED);
    }

    private void running(int attempt) {
        job.setStatus(JobStatus.RUNNING);
        job.setAttemptCount(attempt);
        job.setLeaseExpiresAt(Instant.now().plusSeconds(600));
        job.setWorkerId("jobs-1");
    }
}
