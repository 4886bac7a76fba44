package com.studioflow.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.studioflow.orchestrator.candidate.CandidateController;
import com.studioflow.orchestrator.candidate.CandidateSelectionException;
import com.studioflow.orchestrator.model.*;
import com.studioflow.orchestrator.repository.CandidateRepository;
import com.studioflow.orchestrator.repository.JobEventRepository;
import com.studioflow.orchestrator.repository.JobRepository;
import com.studioflow.orchestrator.repository.JobStepRepository;
import com.studioflow.orchestrator.repository.TrackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Control operations on jobs: creation, status reads, human decisions and
 * cancellation.
 *
 * Every write goes through the job's version check, so a human decision
 * racing a tick either lands before the tick reads the job or makes the
 * tick start over.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository       jobRepo;
    private final CandidateRepository candidateRepo;
    private final JobStepRepository   stepRepo;
    private final TrackRepository     trackRepo;
    private final JobEventRepository  eventRepo;
    private final CandidateController candidates;
    private final ObjectMapper        json;
    private final ObjectMapper        canonicalJson;
    private final int                 defaultMaxTries;

    public JobService(JobRepository jobRepo,
                      CandidateRepository candidateRepo,
                      JobStepRepository stepRepo,
                      TrackRepository trackRepo,
                      JobEventRepository eventRepo,
                      CandidateController candidates,
                      ObjectMapper objectMapper,
                      @Value("${studioflow.lease.default-max-tries:3}") int defaultMaxTries) {
        this.jobRepo         = jobRepo;
        this.candidateRepo   = candidateRepo;
        this.stepRepo        = stepRepo;
        this.trackRepo       = trackRepo;
        this.eventRepo       = eventRepo;
        this.candidates      = candidates;
        this.json            = objectMapper;
        this.canonicalJson   = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.defaultMaxTries = defaultMaxTries;
    }

    /** A job plus whether this call created it or found an earlier identical request. */
    public record CreatedJob(Job job, boolean created) {}

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Create a job, or return the existing one for the same request.
     *
     * Steps:
     *  1. Default the kind to music_video and parse the mode
     *  2. Derive the request hash from the canonical request JSON unless
     *     the caller supplied one
     *  3. INSERT ... ON CONFLICT (kind, request_hash) DO NOTHING
     *  4. Read back whichever row won
     *
     * @throws IllegalArgumentException unknown mode
     */
    @Transactional
    public CreatedJob create(String kind, String mode, String requestHash, Map<String, Object> input) {
        String jobKind = kind == null || kind.isBlank() ? Job.KIND_MUSIC_VIDEO : kind.trim();
        JobMode jobMode = JobMode.fromCode(mode);
        Map<String, Object> jobInput = input == null ? Map.of() : input;
        String hash = requestHash == null || requestHash.isBlank()
                ? requestHash(jobKind, jobMode, jobInput)
                : requestHash.trim();

        String stage = Job.KIND_MUSIC_VIDEO.equals(jobKind) ? Stage.INTENT.name() : "";
        int inserted = jobRepo.insertIfAbsent(UUID.randomUUID(), jobKind, jobMode.name(), stage,
                toJson(jobInput), hash, defaultMaxTries);
        Job job = jobRepo.findByKindAndRequestHash(jobKind, hash)
                .orElseThrow(() -> new IllegalStateException("Job for request " + hash + " vanished after insert"));
        if (inserted == 1) {
            log.info("Created {} job {} (mode={})", jobKind, job.getId(), jobMode.code());
        } else {
            log.info("Request {} already created {} job {}", hash, jobKind, job.getId());
        }
        return new CreatedJob(job, inserted == 1);
    }

    /** SHA-256 of the request with map keys sorted, so key order does not matter. */
    String requestHash(String kind, JobMode mode, Map<String, Object> input) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("kind", kind);
        request.put("mode", mode.code());
        request.put("input", input);
        try {
            byte[] canonical = canonicalJson.writeValueAsBytes(request);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job input is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public List<Track> tracks(UUID jobId) {
        return trackRepo.findByJobId(jobId);
    }

    /** Candidates of a job in creation order, optionally of one type only. */
    @Transactional(readOnly = true)
    public List<Candidate> candidates(UUID jobId, CandidateType type) {
        return type == null
                ? candidateRepo.findByJobIdOrderByCreatedAtAsc(jobId)
                : candidateRepo.findByJobIdAndCandidateTypeOrderByCreatedAtAsc(jobId, type);
    }

    @Transactional(readOnly = true)
    public List<JobStep> steps(UUID jobId) {
        return stepRepo.findByJobIdOrderByCreatedAtAsc(jobId);
    }

    // ------------------------------------------------------------------
    // Human decisions
    // ------------------------------------------------------------------

    /**
     * Choose a candidate the job is waiting on a human to pick.
     *
     * The job must be paused on {@code select_<type>} for exactly the
     * candidate's group and attempt; a stale or foreign pick is rejected.
     *
     * @throws JobNotFoundException        unknown job
     * @throws CandidateSelectionException the job is not waiting for this pick
     */
    @Transactional
    public Candidate selectCandidate(UUID jobId, UUID candidateId) {
        Job job = load(jobId);
        if (job.getStatus().isTerminal()) {
            throw new CandidateSelectionException("Job " + jobId + " is " + job.getStatus());
        }
        Candidate candidate = candidateRepo.findById(candidateId)
                .filter(c -> c.getJobId().equals(jobId))
                .orElseThrow(() -> new CandidateSelectionException(
                        "Candidate " + candidateId + " does not belong to job " + jobId));

        Map<String, Object> action = job.getRequiredAction();
        CandidateType type = candidate.getCandidateType();
        if (action == null || !type.selectActionType().equals(ComputedDocument.string(action, "type"))) {
            throw new CandidateSelectionException("Job " + jobId + " is not waiting for a " + type.code() + " pick");
        }
        if (!candidate.getGroupId().toString().equals(ComputedDocument.string(action, "group_id"))
                || candidate.getAttempt() != ComputedDocument.integer(action, "attempt", -1)) {
            throw new CandidateSelectionException("Candidate " + candidateId + " is not in the group awaiting a pick");
        }

        Candidate chosen = candidates.chooseCandidate(job, candidateId);
        jobRepo.save(job);
        eventRepo.save(new JobEvent(jobId, JobEvent.CANDIDATE_SELECTED,
                Map.of("candidate_id", candidateId.toString(), "candidate_type", type.code())));
        log.info("Job {}: {} candidate {} selected by user", jobId, type.code(), candidateId);
        return chosen;
    }

    /**
     * Answer a non-selection action (upload audio, provide lyrics) by
     * merging {@code patch} into computed and clearing the action.
     *
     * @throws IllegalStateException nothing to resolve, or the pending
     *                               action is a candidate pick
     */
    @Transactional
    public Job resolveAction(UUID jobId, Map<String, Object> patch) {
        Job job = load(jobId);
        if (job.getStatus().isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is " + job.getStatus());
        }
        Map<String, Object> action = job.getRequiredAction();
        if (action == null) {
            throw new IllegalStateException("Job " + jobId + " has no pending action");
        }
        String type = ComputedDocument.string(action, "type");
        if (type != null && type.startsWith("select_")) {
            throw new IllegalStateException("Action " + type + " is resolved by selecting a candidate");
        }

        Map<String, Object> merged = new LinkedHashMap<>(patch == null ? Map.of() : patch);
        merged.put("required_action", null);
        merged.put("last_resolved_action", type);
        job.patchComputed(merged);
        jobRepo.save(job);
        eventRepo.save(new JobEvent(jobId, JobEvent.ACTION_RESOLVED, Map.of("action", String.valueOf(type))));
        log.info("Job {}: action {} resolved", jobId, type);
        return job;
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Stop a job for good. Ticks never touch a cancelled job again and late
     * provider results are recorded on their runs only.
     *
     * @throws IllegalStateException the job already succeeded or failed
     */
    @Transactional
    public Job cancel(UUID jobId) {
        Job job = load(jobId);
        if (job.getStatus() == JobStatus.CANCELLED) {
            return job;
        }
        if (job.getStatus().isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " already " + job.getStatus());
        }
        job.setStatus(JobStatus.CANCELLED);
        job.setLeaseExpiresAt(null);
        job.setErrorCode("CANCELLED");
        job.setErrorMessage("cancelled by request");
        log.info("Job {} cancelled at {}", jobId, job.getStage() == null ? "-" : job.getStage().code());
        return jobRepo.save(job);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job load(UUID jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private String toJson(Map<String, Object> value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job input is not serializable", e);
        }
    }
}
