package com.studioflow.orchestrator.queue;

import com.studioflow.orchestrator.blob.BlobStore;
import com.studioflow.orchestrator.blob.BlobStoreException;
import com.studioflow.orchestrator.candidate.CandidateController;
import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.ProviderRun;
import com.studioflow.orchestrator.model.RunStatus;
import com.studioflow.orchestrator.model.RunType;
import com.studioflow.orchestrator.provider.ProviderException;
import com.studioflow.orchestrator.provider.ProviderPoll;
import com.studioflow.orchestrator.provider.ProviderRegistry;
import com.studioflow.orchestrator.provider.ProviderRequest;
import com.studioflow.orchestrator.provider.ProviderState;
import com.studioflow.orchestrator.repository.JobRepository;
import com.studioflow.orchestrator.workflow.WorkflowNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes one claimed provider run from start to terminal write.
 *
 * For a given run, this class:
 *   1. re-checks the job and the candidate (a run whose job or candidate is
 *      already terminal is abandoned without calling the provider)
 *   2. submits the request and polls the provider until it is terminal or
 *      the timeout passes
 *   3. moves any returned bytes into the blob store
 *   4. writes the outcome (candidate and run together for candidate runs)
 *   5. notifies the workflow so the waiting fan-in sees the result at once
 *
 * Provider failures never escape: they become a FAILED run. Retries happen
 * at candidate-group granularity, never per run.
 */
@Component
public class ProviderRunExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProviderRunExecutor.class);

    private final ProviderRegistry    registry;
    private final BlobStore           blobs;
    private final ProviderRunQueue    queue;
    private final CandidateController candidates;
    private final WorkflowNotifier    notifier;
    private final JobRepository       jobRepo;
    private final Duration            pollInterval;
    private final Duration            timeout;

    public ProviderRunExecutor(ProviderRegistry registry,
                               BlobStore blobs,
                               ProviderRunQueue queue,
                               CandidateController candidates,
                               WorkflowNotifier notifier,
                               JobRepository jobRepo,
                               @Value("${studioflow.provider.poll-interval-ms:500}") long pollIntervalMs,
                               @Value("${studioflow.provider.timeout-sec:300}") long timeoutSec) {
        this.registry     = registry;
        this.blobs        = blobs;
        this.queue        = queue;
        this.candidates   = candidates;
        this.notifier     = notifier;
        this.jobRepo      = jobRepo;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.timeout      = Duration.ofSeconds(timeoutSec);
    }

    // ------------------------------------------------------------------
    // Entry point, called by ProviderRunScheduler for each claimed run
    // ------------------------------------------------------------------

    public void run(ProviderRun run) {
        MDC.put("jobId",   run.getJobId().toString());
        MDC.put("runId",   run.getId().toString());
        MDC.put("runType", run.getRunType());
        MDC.put("attempt", String.valueOf(run.getAttempt()));
        if (run.getCandidateId() != null) MDC.put("candidateId", run.getCandidateId().toString());
        try {
            RunType type = run.runType();
            Job job = jobRepo.findById(run.getJobId()).orElse(null);
            if (job != null && job.getStatus().isTerminal()) {
                String reason = "job_" + job.getStatus().name().toLowerCase();
                queue.setResult(run.getId(), RunStatus.ABANDONED, null,
                        Map.of("skipped", true, "skip_reason", reason));
                log.info("Run {} abandoned before submit: job {} is {}", run.getId(), job.getId(), job.getStatus());
                return;
            }
            if (type.isCandidateRun() && !candidates.markRunning(run.getCandidateId())) {
                queue.setResult(run.getId(), RunStatus.ABANDONED, null,
                        Map.of("skipped", true, "skip_reason", "candidate_terminal"));
                log.info("Run {} abandoned before submit: candidate {} is already terminal",
                        run.getId(), run.getCandidateId());
                return;
            }

            RunResult result = execute(run, type);
            record(run, type, result);
        } finally {
            notifier.notifyJob(run.getJobId(), "provider_run_done");
            MDC.clear();
        }
    }

    /**
     * Last-resort terminal write for a run whose execution threw. Keeps the
     * group from waiting forever on a run nobody will finish.
     */
    public void failUnexpected(ProviderRun run, Exception cause) {
        try {
            record(run, run.runType(), RunResult.failed("Unhandled worker error: " + cause.getMessage(), null));
        } catch (Exception e) {
            log.error("Could not fail run {} after worker error: {}", run.getId(), e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Provider round trip
    // ------------------------------------------------------------------

    RunResult execute(ProviderRun run, RunType type) {
        ProviderRequest request = new ProviderRequest(run.getJobId(), type,
                ComputedDocument.integer(run.getRequest(), "variant_index", 0),
                run.getAttempt(), run.getRequest());
        String providerJobId = null;
        try {
            providerJobId = registry.submit(run.getProvider(), request, run.getIdempotencyKey());
            queue.markSubmitted(run.getId(), providerJobId);

            ProviderPoll poll = awaitTerminal(run.getProvider(), providerJobId);
            if (poll.state() != ProviderState.SUCCEEDED) {
                log.warn("Provider '{}' failed run {}: {}", run.getProvider(), run.getId(), poll.error());
                return RunResult.failed(poll.error() == null ? "provider failed" : poll.error(), providerJobId);
            }
            String mediaRef = poll.hasPayload() ? blobs.put(poll.payload(), poll.contentType()) : null;
            log.info("Provider '{}' finished run {} (media={})", run.getProvider(), run.getId(), mediaRef);
            return new RunResult(true, poll.output(), mediaRef, poll.contentType(), null, providerJobId);
        } catch (ProviderException | BlobStoreException e) {
            log.warn("Run {} failed: {}", run.getId(), e.getMessage());
            return RunResult.failed(e.getMessage(), providerJobId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RunResult.failed("Worker interrupted while polling", providerJobId);
        }
    }

    private ProviderPoll awaitTerminal(String provider, String providerJobId) throws InterruptedException {
        Instant deadline = Instant.now().plus(timeout);
        while (true) {
            ProviderPoll poll = registry.poll(provider, providerJobId);
            if (poll.state().isTerminal()) {
                return poll;
            }
            if (Instant.now().isAfter(deadline)) {
                throw new ProviderException(ProviderException.Kind.TIMEOUT,
                        "Provider '" + provider + "' did not finish " + providerJobId + " within " + timeout);
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }

    // ------------------------------------------------------------------
    // Terminal write
    // ------------------------------------------------------------------

    private void record(ProviderRun run, RunType type, RunResult result) {
        if (!type.isCandidateRun()) {
            queue.setResult(run.getId(), result.succeeded() ? RunStatus.SUCCEEDED : RunStatus.FAILED,
                    result.response(), meta(result));
            return;
        }
        try {
            candidates.recordRunOutcome(run, result);
        } catch (OptimisticLockingFailureException e) {
            // A selection touched the candidate meanwhile; re-read decides (usually ABANDONED).
            log.info("Candidate {} changed while run {} finished, re-recording", run.getCandidateId(), run.getId());
            candidates.recordRunOutcome(run, result);
        }
    }

    private static Map<String, Object> meta(RunResult result) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (result.providerJobId() != null) meta.put("provider_job_id", result.providerJobId());
        return meta;
    }
}
