package com.studioflow.orchestrator.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.JobEvent;
import com.studioflow.orchestrator.model.ProviderRun;
import com.studioflow.orchestrator.model.RunStatus;
import com.studioflow.orchestrator.repository.JobEventRepository;
import com.studioflow.orchestrator.repository.ProviderRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable queue of provider runs.
 *
 * All methods are @Transactional: enqueue joins the caller's transaction
 * (a rolled-back tick leaves no orphan runs), and the claim SELECT FOR
 * UPDATE SKIP LOCKED stays locked until the row is flipped to RUNNING.
 */
@Service
public class ProviderRunQueue {

    private static final Logger log = LoggerFactory.getLogger(ProviderRunQueue.class);

    private final ProviderRunRepository runRepo;
    private final JobEventRepository    eventRepo;
    private final ObjectMapper          json;

    public ProviderRunQueue(ProviderRunRepository runRepo,
                            JobEventRepository eventRepo,
                            ObjectMapper objectMapper) {
        this.runRepo   = runRepo;
        this.eventRepo = eventRepo;
        this.json      = objectMapper;
    }

    // ------------------------------------------------------------------
    // Enqueue
    // ------------------------------------------------------------------

    /**
     * Insert the run unless a run with the same idempotency key exists.
     *
     * @return the id of the inserted run, or of the existing one
     */
    @Transactional
    public UUID enqueue(RunSpec spec) {
        String key = spec.idempotencyKey();
        Map<String, Object> meta = new LinkedHashMap<>(spec.meta());
        meta.put("run_type", spec.runType().code());
        meta.put("attempt", spec.attempt());
        if (spec.groupId() != null)     meta.put("group_id", spec.groupId().toString());
        if (spec.candidateId() != null) meta.put("candidate_id", spec.candidateId().toString());

        UUID id = UUID.randomUUID();
        int inserted = runRepo.insertIfAbsent(
                id,
                spec.jobId(),
                spec.provider(),
                key,
                spec.runType().code(),
                spec.groupId() == null ? "" : spec.groupId().toString(),
                spec.candidateId() == null ? "" : spec.candidateId().toString(),
                spec.attempt(),
                toJson(spec.request()),
                toJson(meta));
        if (inserted == 1) {
            log.debug("Enqueued {} run {} on '{}' (job={})",
                    spec.runType().code(), id, spec.provider(), spec.jobId());
            return id;
        }
        UUID existing = runRepo.findByIdempotencyKey(key)
                .map(ProviderRun::getId)
                .orElseThrow(() -> new IllegalStateException("Run with key " + key + " vanished after conflict"));
        log.debug("Run for key {} already enqueued as {}", key, existing);
        return existing;
    }

    // ------------------------------------------------------------------
    // Claim
    // ------------------------------------------------------------------

    /**
     * Claim the oldest CREATED run for this worker.
     *
     * Safe to call from any number of threads and processes: SKIP LOCKED
     * guarantees no two callers ever receive the same run.
     */
    @Transactional
    public Optional<ProviderRun> claimNext(String workerId) {
        Optional<ProviderRun> opt = runRepo.lockNextCreated();
        opt.ifPresent(run -> {
            run.setStatus(RunStatus.RUNNING);
            run.setWorkerId(workerId);
            run.setStartedAt(Instant.now());
            runRepo.save(run);
            log.info("Worker '{}' claimed run {} ({} on '{}', job={})",
                    workerId, run.getId(), run.getRunType(), run.getProvider(), run.getJobId());
        });
        return opt;
    }

    /** Remember the provider's own job id so a restarted worker can be traced. */
    @Transactional
    public void markSubmitted(UUID runId, String providerJobId) {
        runRepo.findById(runId).ifPresent(run -> {
            if (run.getStatus().isTerminal()) return;
            run.setProviderJobId(providerJobId);
            runRepo.save(run);
        });
    }

    // ------------------------------------------------------------------
    // Terminal write
    // ------------------------------------------------------------------

    /**
     * Write the terminal status of a run and announce it on the outbox.
     *
     * A run is never modified after it is terminal: a second call is logged
     * and ignored.
     *
     * @return true when this call performed the terminal write
     */
    @Transactional
    public boolean setResult(UUID runId, RunStatus status,
                             Map<String, Object> response, Map<String, Object> metaPatch) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("setResult needs a terminal status, got " + status);
        }
        ProviderRun run = runRepo.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("Provider run not found: " + runId));
        if (run.getStatus().isTerminal()) {
            log.info("Run {} already {}, ignoring late {} result", runId, run.getStatus(), status);
            return false;
        }
        run.setStatus(status);
        run.setResponse(response);
        if (metaPatch != null && !metaPatch.isEmpty()) run.patchMeta(metaPatch);
        run.setFinishedAt(Instant.now());
        runRepo.save(run);

        eventRepo.save(new JobEvent(run.getJobId(), JobEvent.PROVIDER_RUN_DONE,
                Map.of("run_id", runId.toString(), "status", status.name())));
        log.info("Run {} -> {} (job={})", runId, status, run.getJobId());
        return true;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String toJson(Map<String, Object> value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Provider run payload is not serializable", e);
        }
    }
}
