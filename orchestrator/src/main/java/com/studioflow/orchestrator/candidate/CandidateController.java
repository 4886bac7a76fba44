package com.studioflow.orchestrator.candidate;

import com.studioflow.orchestrator.model.Candidate;
import com.studioflow.orchestrator.model.CandidateStatus;
import com.studioflow.orchestrator.model.CandidateType;
import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.ProviderRun;
import com.studioflow.orchestrator.model.RunStatus;
import com.studioflow.orchestrator.queue.ProviderRunQueue;
import com.studioflow.orchestrator.queue.RunResult;
import com.studioflow.orchestrator.queue.RunSpec;
import com.studioflow.orchestrator.repository.CandidateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fan-out / fan-in over candidate groups.
 *
 * A group is one round of N parallel attempts of the same candidate type.
 * The job's {@code computed.candidates.<type>} pointer names the current
 * round; {@code computed.attempts.<type>} names the attempt the next
 * fan-out will use. Graph methods take the already-loaded {@link Job} and
 * only mutate it in memory: the router persists it with a version check,
 * so a racing tick rolls back every row written here.
 */
@Service
public class CandidateController {

    private static final Logger log = LoggerFactory.getLogger(CandidateController.class);

    /** Score assumed when a provider reports none. */
    static final Map<CandidateType, Double> DEFAULT_SCORES = Map.of(
            CandidateType.LYRICS, 0.6,
            CandidateType.AUDIO,  0.7,
            CandidateType.VIDEO,  0.6);

    /** Auto-selection order: highest overall score, then lowest variant index. */
    static final Comparator<Candidate> BEST_FIRST = Comparator
            .comparingDouble(Candidate::overallScore).reversed()
            .thenComparingInt(Candidate::getVariantIndex);

    private final CandidateRepository candidateRepo;
    private final ProviderRunQueue    runQueue;
    private final Map<CandidateType, CandidatePromotion> promotions = new EnumMap<>(CandidateType.class);
    private final int maxAttempts;

    public CandidateController(CandidateRepository candidateRepo,
                               ProviderRunQueue runQueue,
                               List<CandidatePromotion> allPromotions,
                               @Value("${studioflow.workflow.max-candidate-attempts:3}") int maxAttempts) {
        this.candidateRepo = candidateRepo;
        this.runQueue      = runQueue;
        this.maxAttempts   = maxAttempts;
        for (CandidatePromotion p : allPromotions) {
            promotions.put(p.type(), p);
        }
        for (CandidateType t : CandidateType.values()) {
            if (!promotions.containsKey(t)) {
                throw new IllegalStateException("No promotion registered for " + t);
            }
        }
    }

    // ------------------------------------------------------------------
    // Fan-out
    // ------------------------------------------------------------------

    /**
     * Start a round of {@code count} candidates unless the job already
     * points at a round for the current attempt.
     *
     * Providers are assigned round-robin by variant index. Each candidate
     * gets exactly one provider run keyed on (job, run type, candidate, attempt).
     *
     * @param hitl   whether the round waits for a human pick
     * @param params provider parameters shared by every variant
     * @return the group id of the current round
     */
    @Transactional
    public UUID fanOut(Job job, CandidateType type, int count, List<String> providers,
                       boolean hitl, Map<String, Object> params) {
        int attempt = currentAttempt(job, type);
        Map<String, Object> pointer = pointer(job, type);
        String existing = ComputedDocument.string(pointer, "group_id");
        if (existing != null && ComputedDocument.integer(pointer, "attempt", 1) == attempt) {
            log.debug("Job {} already has {} group {} for attempt {}", job.getId(), type.code(), existing, attempt);
            return UUID.fromString(existing);
        }
        if (count < 1) {
            throw new IllegalArgumentException("Candidate count must be positive, got " + count);
        }
        List<String> pool = providers == null || providers.isEmpty() ? List.of("native") : providers;

        UUID groupId = UUID.randomUUID();
        List<Candidate> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String provider = pool.get(i % pool.size());
            Candidate c = new Candidate(job.getId(), type, groupId, i, attempt, provider);

            Map<String, Object> request = new LinkedHashMap<>(params == null ? Map.of() : params);
            request.put("candidate_type", type.code());
            request.put("group_id", groupId.toString());
            request.put("variant_index", i);
            request.put("attempt", attempt);

            UUID runId = runQueue.enqueue(new RunSpec(job.getId(), provider, type.runType(),
                    groupId, c.getId(), attempt, request, Map.of("variant_index", i)));
            c.setProviderRunId(runId);
            created.add(c);
        }
        candidateRepo.saveAll(created);

        Map<String, Object> round = new LinkedHashMap<>();
        round.put("group_id", groupId.toString());
        round.put("attempt", attempt);
        round.put("hitl", hitl);
        round.put("count", count);
        job.patchComputed(Map.of("candidates", Map.of(type.code(), round)));

        log.info("Job {} fanned out {} {} candidates (group={}, attempt={}, providers={})",
                job.getId(), count, type.code(), groupId, attempt, pool);
        return groupId;
    }

    // ------------------------------------------------------------------
    // Fan-in
    // ------------------------------------------------------------------

    /**
     * Inspect the current round and decide what happens next.
     *
     * Retry resets the pointer and bumps the attempt; exhausting the
     * attempt cap is reported, not acted on, so the caller decides how the
     * job fails.
     */
    @Transactional
    public FanInResult fanIn(Job job, CandidateType type) {
        Map<String, Object> pointer = pointer(job, type);
        String gid = ComputedDocument.string(pointer, "group_id");
        if (gid == null) {
            return FanInResult.of(FanInOutcome.NO_GROUP, null, currentAttempt(job, type));
        }
        UUID groupId = UUID.fromString(gid);
        int  attempt = ComputedDocument.integer(pointer, "attempt", 1);

        List<Candidate> members = candidateRepo
                .findByJobIdAndCandidateTypeAndGroupIdAndAttemptOrderByVariantIndexAsc(
                        job.getId(), type, groupId, attempt);
        if (members.isEmpty() || members.stream().anyMatch(c -> !c.getStatus().isTerminal())) {
            return FanInResult.of(FanInOutcome.WAITING_PARALLEL, groupId, attempt);
        }

        // A human already picked (selection promotes immediately).
        for (Candidate c : members) {
            if (c.getStatus() == CandidateStatus.CHOSEN) {
                return FanInResult.chosen(groupId, attempt, c.getId());
            }
        }

        List<Candidate> succeeded = members.stream()
                .filter(c -> c.getStatus() == CandidateStatus.SUCCEEDED)
                .toList();
        if (succeeded.isEmpty()) {
            if (attempt >= maxAttempts) {
                log.warn("Job {}: every {} candidate failed on attempt {}/{}, giving up",
                        job.getId(), type.code(), attempt, maxAttempts);
                return FanInResult.of(FanInOutcome.EXHAUSTED, groupId, attempt);
            }
            job.patchComputed(Map.of(
                    "attempts",   Map.of(type.code(), attempt + 1),
                    "candidates", Map.of(type.code(), Map.of())));
            log.warn("Job {}: every {} candidate failed on attempt {}, retrying as attempt {}",
                    job.getId(), type.code(), attempt, attempt + 1);
            return FanInResult.of(FanInOutcome.RETRY, groupId, attempt);
        }

        if (ComputedDocument.flag(pointer, "hitl")) {
            Map<String, Object> action = new LinkedHashMap<>();
            action.put("type", type.selectActionType());
            action.put("candidate_type", type.code());
            action.put("group_id", groupId.toString());
            action.put("attempt", attempt);
            action.put("min_select", 1);
            action.put("max_select", 1);
            action.put("message", "Pick one of " + succeeded.size() + " " + type.code() + " candidates");
            job.patchComputed(Map.of("required_action", action));
            log.info("Job {} waiting for a {} pick (group={})", job.getId(), type.code(), groupId);
            return FanInResult.of(FanInOutcome.ACTION_REQUIRED, groupId, attempt);
        }

        Candidate best = pickBest(succeeded);
        chooseCandidate(job, best.getId());
        return FanInResult.chosen(groupId, attempt, best.getId());
    }

    /**
     * Highest {@code score.overall} wins; missing or unparseable scores
     * count as 0.0; equal scores go to the lowest variant index.
     */
    public static Candidate pickBest(List<Candidate> succeeded) {
        return succeeded.stream()
                .min(BEST_FIRST)
                .orElseThrow(() -> new IllegalArgumentException("No candidate to pick from"));
    }

    // ------------------------------------------------------------------
    // Selection
    // ------------------------------------------------------------------

    /**
     * Mark one candidate CHOSEN, discard its siblings and promote it.
     *
     * Choosing the already-chosen candidate again is a no-op. The partial
     * unique index on (group_id) WHERE status = 'CHOSEN' backs the
     * at-most-one rule at the database level.
     */
    @Transactional
    public Candidate chooseCandidate(Job job, UUID candidateId) {
        Candidate target = candidateRepo.findById(candidateId)
                .orElseThrow(() -> new CandidateSelectionException("Candidate not found: " + candidateId));
        if (!target.getJobId().equals(job.getId())) {
            throw new CandidateSelectionException("Candidate " + candidateId + " belongs to another job");
        }
        if (target.getStatus() == CandidateStatus.CHOSEN) {
            return target;
        }
        if (target.getStatus() != CandidateStatus.SUCCEEDED) {
            throw new CandidateSelectionException(
                    "Candidate " + candidateId + " is " + target.getStatus() + ", only SUCCEEDED can be chosen");
        }

        List<Candidate> group = candidateRepo.findByGroupIdOrderByVariantIndexAsc(target.getGroupId());
        List<Candidate> changed = new ArrayList<>();
        for (Candidate sibling : group) {
            if (sibling.getId().equals(target.getId())) continue;
            if (sibling.getStatus() == CandidateStatus.CHOSEN) {
                throw new CandidateSelectionException(
                        "Group " + target.getGroupId() + " already has chosen candidate " + sibling.getId());
            }
            if (sibling.getStatus() != CandidateStatus.DISCARDED) {
                sibling.setStatus(CandidateStatus.DISCARDED);
                changed.add(sibling);
            }
        }
        target.setStatus(CandidateStatus.CHOSEN);
        target.setChosenAt(Instant.now());
        changed.add(target);
        candidateRepo.saveAll(changed);

        CandidateType type = target.getCandidateType();
        Map<String, Object> patch = new LinkedHashMap<>(promotions.get(type).promote(job, target));
        patch.put("chosen_" + type.code() + "_candidate_id", target.getId().toString());
        patch.put("required_action", null);
        job.patchComputed(patch);

        log.info("Job {} chose {} candidate {} (variant {}, score {})",
                job.getId(), type.code(), target.getId(), target.getVariantIndex(), target.overallScore());
        return target;
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    /**
     * Flip a candidate to RUNNING before its provider is called.
     *
     * @return false when the candidate is already terminal and the run
     *         should be abandoned instead
     */
    @Transactional
    public boolean markRunning(UUID candidateId) {
        Candidate c = candidateRepo.findById(candidateId).orElse(null);
        if (c == null || c.getStatus().isTerminal()) {
            return false;
        }
        c.setStatus(CandidateStatus.RUNNING);
        candidateRepo.save(c);
        return true;
    }

    /**
     * Write a finished candidate run: candidate status and output plus the
     * run's terminal status, in one transaction.
     *
     * A candidate that reached any terminal status meanwhile (for example
     * failed by the stall reaper) keeps it; the run is recorded as ABANDONED.
     */
    @Transactional
    public void recordRunOutcome(ProviderRun run, RunResult result) {
        Candidate c = candidateRepo.findById(run.getCandidateId()).orElse(null);
        if (c == null || c.getStatus().isTerminal()) {
            String reason = c == null ? "candidate_missing" : "candidate_" + c.getStatus().name().toLowerCase();
            runQueue.setResult(run.getId(), RunStatus.ABANDONED, result.response(),
                    Map.of("skipped", true, "skip_reason", reason));
            log.info("Run {} abandoned: {}", run.getId(), reason);
            return;
        }

        String invalid = result.succeeded() ? validateOutput(c.getCandidateType(), result) : null;
        if (result.succeeded() && invalid == null) {
            Map<String, Object> content = new LinkedHashMap<>(result.output());
            Object score = content.remove("score");
            c.setContent(content);
            c.setScore(score instanceof Map<?, ?> ? castMap(score)
                    : Map.of("overall", DEFAULT_SCORES.get(c.getCandidateType())));
            c.setMediaRef(result.mediaRef());
            int duration = ComputedDocument.integer(result.output(), "duration_ms", 0);
            c.setDurationMs(duration > 0 ? (long) duration : null);
            c.setStatus(CandidateStatus.SUCCEEDED);
        } else {
            String error = invalid != null ? invalid : result.error();
            c.setStatus(CandidateStatus.FAILED);
            c.patchMeta(Map.of("error", error == null ? "provider failed" : error));
        }
        candidateRepo.save(c);

        RunStatus runStatus = c.getStatus() == CandidateStatus.SUCCEEDED ? RunStatus.SUCCEEDED : RunStatus.FAILED;
        runQueue.setResult(run.getId(), runStatus, result.response(),
                Map.of("candidate_status", c.getStatus().name()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Provider output is decoded per candidate type here; null means it is usable. */
    static String validateOutput(CandidateType type, RunResult result) {
        return switch (type) {
            case LYRICS -> ComputedDocument.string(result.output(), "lyrics_text") == null
                    ? "provider returned no lyrics_text" : null;
            case AUDIO, VIDEO -> result.mediaRef() == null
                    ? "provider returned no " + type.code() + " media" : null;
        };
    }

    static int currentAttempt(Job job, CandidateType type) {
        return Math.max(1, ComputedDocument.integer(ComputedDocument.map(job.getComputed(), "attempts"), type.code(), 1));
    }

    private static Map<String, Object> pointer(Job job, CandidateType type) {
        return ComputedDocument.map(job.getComputed(), "candidates", type.code());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object value) {
        return (Map<String, Object>) value;
    }
}
