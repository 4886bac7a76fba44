package com.studioflow.orchestrator.workflow;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.model.StopReason;
import com.studioflow.orchestrator.repository.JobRepository;
import com.studioflow.orchestrator.service.JobNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Advances graph jobs through {@link StageGraph}.
 *
 * One tick:
 *   1. loads the job (and gives up on terminal jobs untouched)
 *   2. runs the node of the current stage, then the next one, inside a
 *      single transaction, until a node asks to stop or the step budget
 *      is spent
 *   3. writes stage, progress and {@code computed.graph} in one
 *      version-checked UPDATE
 *
 * If another writer bumped the job version in between, everything the
 * tick wrote (candidates, run enqueues, tracks) rolls back and the tick
 * starts over from a fresh read.
 *
 * Metrics:
 * <pre>
 *   studioflow.ticks{stop="waiting_parallel|action_required|done|budget|conflict|error"}
 *   studioflow.tick.duration
 * </pre>
 */
@Component
public class StageRouter {

    private static final Logger log = LoggerFactory.getLogger(StageRouter.class);

    static final int MAX_CAS_RETRIES = 5;

    private final JobRepository       jobRepo;
    private final StepLog             stepLog;
    private final TransactionTemplate tx;
    private final MeterRegistry       meterRegistry;
    private final Map<Stage, StageNode> nodes = new EnumMap<>(Stage.class);
    private final int stepBudget;

    public StageRouter(JobRepository jobRepo,
                       StepLog stepLog,
                       PlatformTransactionManager txManager,
                       MeterRegistry meterRegistry,
                       List<StageNode> allNodes,
                       @Value("${studioflow.workflow.step-budget:32}") int stepBudget) {
        this.jobRepo       = jobRepo;
        this.stepLog       = stepLog;
        this.tx            = new TransactionTemplate(txManager);
        this.meterRegistry = meterRegistry;
        this.stepBudget    = stepBudget;
        for (StageNode node : allNodes) {
            StageNode previous = nodes.put(node.stage(), node);
            if (previous != null) {
                throw new IllegalStateException("Two nodes registered for stage " + node.stage().code());
            }
        }
        for (Stage s : Stage.values()) {
            if (!nodes.containsKey(s)) {
                throw new IllegalStateException("No node registered for stage " + s.code());
            }
        }
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Advance one job as far as it can go right now.
     *
     * @param trigger free-form label of who asked ("api", "sweep",
     *                "provider_run_done", ...), stored in computed.graph
     * @throws JobNotFoundException     unknown job id
     * @throws IllegalArgumentException the job is not a graph job
     * @throws WorkflowException        CONCURRENCY when every CAS retry lost
     */
    public TickResult tick(UUID jobId, String trigger) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            for (int attempt = 1; attempt <= MAX_CAS_RETRIES; attempt++) {
                try {
                    TickResult result = tx.execute(status -> tickOnce(jobId, trigger));
                    outcome = result.stopReason() == null ? "budget" : result.stopReason().code();
                    return result;
                } catch (OptimisticLockingFailureException e) {
                    log.info("Tick of job {} lost a version race (attempt {}/{}), retrying",
                            jobId, attempt, MAX_CAS_RETRIES);
                } catch (NodeFailure f) {
                    recordNodeError(jobId, f);
                    throw f.error;
                }
            }
            outcome = "conflict";
            throw new WorkflowException(WorkflowException.Kind.CONCURRENCY, "TICK_CONFLICT",
                    "Job " + jobId + " changed concurrently " + MAX_CAS_RETRIES + " times in a row");
        } finally {
            sample.stop(meterRegistry.timer("studioflow.tick.duration"));
            meterRegistry.counter("studioflow.ticks", "stop", outcome).increment();
        }
    }

    // ------------------------------------------------------------------
    // One transactional pass
    // ------------------------------------------------------------------

    private TickResult tickOnce(UUID jobId, String trigger) {
        Job job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        Stage stageIn = job.getStage();

        if (job.getStatus().isTerminal()) {
            log.debug("Job {} is {}, tick ignored", jobId, job.getStatus());
            return new TickResult(jobId, stageIn, stageIn, StopReason.DONE, job.getStatus(), 0);
        }
        if (!job.isGraphJob()) {
            throw new IllegalArgumentException("Job " + jobId + " of kind '" + job.getKind() + "' is not a graph job");
        }
        if (job.getStatus() == JobStatus.QUEUED) {
            job.setStatus(JobStatus.RUNNING);
        }

        Stage current = stageIn;
        StopReason stop = null;
        int nodesRun = 0;
        while (stop == null && nodesRun < stepBudget) {
            if (job.getRequiredAction() != null) {
                stop = StopReason.ACTION_REQUIRED;
                break;
            }
            StageNode node = nodes.get(current);
            stepLog.record(jobId, current.code(), StepLog.RUNNING, Map.of("trigger", trigger));

            NodeResult result;
            try {
                result = node.run(job);
            } catch (WorkflowException e) {
                if (!e.failsJob()) throw new NodeFailure(current, e);
                job.fail(e.getCode(), e.getMessage());
                stepLog.record(jobId, current.code(), StepLog.FAILED, Map.of("error_code", e.getCode()));
                log.warn("Job {} failed at {}: {} {}", jobId, current.code(), e.getCode(), e.getMessage());
                stop = StopReason.DONE;
                nodesRun++;
                break;
            } catch (OptimisticLockingFailureException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new NodeFailure(current, e);
            }
            nodesRun++;

            StageGraph.requireAllowed(current, result.next());
            stepLog.record(jobId, current.code(),
                    result.stopReason() == StopReason.WAITING_PARALLEL ? StepLog.WAITING : StepLog.SUCCEEDED);
            if (result.next() != current) {
                log.info("Job {} {} -> {}", jobId, current.code(), result.next().code());
            }
            current = result.next();
            job.setStage(current);
            job.setProgress(Math.max(job.getProgress(), current.progress()));
            stop = job.getStatus().isTerminal() ? StopReason.DONE : result.stopReason();
        }
        if (stop == null) {
            log.warn("Job {} spent its step budget of {} at {}", jobId, stepBudget, current.code());
        }

        Map<String, Object> graph = new LinkedHashMap<>();
        graph.put("stage", current.code());
        graph.put("stop_reason", stop == null ? "step_budget" : stop.code());
        graph.put("last_tick_at", Instant.now().toString());
        graph.put("last_trigger", trigger);
        graph.put("last_stage_in", stageIn.code());
        graph.put("last_stage_out", current.code());
        job.patchComputed(Map.of("graph", graph));
        if (job.getStatus() != JobStatus.FAILED && "NODE_ERROR".equals(job.getErrorCode())) {
            job.setErrorCode(null);
            job.setErrorMessage(null);
        }

        // saveAndFlush surfaces a lost version race here, inside the retry loop.
        jobRepo.saveAndFlush(job);
        return new TickResult(jobId, stageIn, current, stop, job.getStatus(), nodesRun);
    }

    /**
     * A non-fatal node failure: the tick is rolled back and the error is
     * left on the job for operators. The next trigger retries the stage.
     */
    private void recordNodeError(UUID jobId, NodeFailure f) {
        log.error("Node {} failed for job {}: {}", f.stage.code(), jobId, f.error.getMessage(), f.error);
        stepLog.record(jobId, f.stage.code(), StepLog.FAILED,
                Map.of("error", String.valueOf(f.error.getMessage())));
        try {
            tx.executeWithoutResult(status -> jobRepo.findById(jobId).ifPresent(job -> {
                if (job.getStatus().isTerminal()) return;
                job.setErrorCode("NODE_ERROR");
                job.setErrorMessage(f.stage.code() + ": " + f.error.getMessage());
                jobRepo.saveAndFlush(job);
            }));
        } catch (Exception e) {
            log.warn("Could not record node error on job {}: {}", jobId, e.getMessage());
        }
    }

    /** Carries a node exception out of the transaction so it rolls back. */
    private static final class NodeFailure extends RuntimeException {
        final Stage            stage;
        final RuntimeException error;

        NodeFailure(Stage stage, RuntimeException error) {
            super(error);
            this.stage = stage;
            this.error = error;
        }
    }
}
