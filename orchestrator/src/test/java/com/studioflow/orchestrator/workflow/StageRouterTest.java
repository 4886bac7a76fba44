package com.studioflow.orchestrator.workflow;

import com.studioflow.orchestrator.model.*;
import com.studioflow.orchestrator.repository.JobRepository;
import com.studioflow.orchestrator.service.JobNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.*;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * StageRouter with scripted nodes. The transaction manager is a mock, so
 * TransactionTemplate simply runs the callback.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StageRouterTest {

    @Mock JobRepository              jobRepo;
    @Mock StepLog                    stepLog;
    @Mock PlatformTransactionManager txManager;

    private final Map<Stage, Function<Job, NodeResult>> script = new EnumMap<>(Stage.class);
    private SimpleMeterRegistry meterRegistry;
    private Job job;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        job = new Job(UUID.randomUUID(), Job.KIND_MUSIC_VIDEO, JobMode.AUTOPILOT, Map.of("title", "t"), "h");
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepo.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    // ------------------------------------------------------------------
    // Advancing
    // ------------------------------------------------------------------

    @Test
    void tick_runsNodesUntilOneWaits() {
        script.put(Stage.INTENT, j -> NodeResult.advance(Stage.PLAN));
        script.put(Stage.PLAN, j -> NodeResult.advance(Stage.LYRICS_FANOUT));
        script.put(Stage.LYRICS_FANOUT, j -> NodeResult.advance(Stage.LYRICS_FANIN));
        script.put(Stage.LYRICS_FANIN, j -> NodeResult.waitAt(Stage.LYRICS_FANIN));

        TickResult result = router(32).tick(job.getId(), "api");

        assertThat(result.stageIn()).isEqualTo(Stage.INTENT);
        assertThat(result.stageOut()).isEqualTo(Stage.LYRICS_FANIN);
        assertThat(result.stopReason()).isEqualTo(StopReason.WAITING_PARALLEL);
        assertThat(result.nodesRun()).isEqualTo(4);
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getProgress()).isEqualTo(Stage.LYRICS_FANIN.progress());
        assertThat(ComputedDocument.map(job.getComputed(), "graph"))
                .containsEntry("stage", "lyrics_fanin")
                .containsEntry("stop_reason", "waiting_parallel")
                .containsEntry("last_trigger", "api");
        verify(jobRepo).saveAndFlush(job);
        verify(stepLog).record(job.getId(), "lyrics_fanin", StepLog.WAITING);
        assertThat(meterRegistry.counter("studioflow.ticks", "stop", "waiting_parallel").count()).isEqualTo(1.0);
    }

    @Test
    void tick_terminalJob_isLeftUntouched() {
        job.setStatus(JobStatus.CANCELLED);

        TickResult result = router(32).tick(job.getId(), "sweep");

        assertThat(result.stopReason()).isEqualTo(StopReason.DONE);
        assertThat(result.nodesRun()).isZero();
        verify(jobRepo, never()).saveAndFlush(any());
    }

    @Test
    void tick_pendingAction_stopsBeforeRunningNode() {
        job.patchComputed(Map.of("required_action", Map.of("type", "upload_audio")));

        TickResult result = router(32).tick(job.getId(), "api");

        assertThat(result.stopReason()).isEqualTo(StopReason.ACTION_REQUIRED);
        assertThat(result.nodesRun()).isZero();
    }

    @Test
    void tick_stepBudgetSpent_stopsWithoutReason() {
        script.put(Stage.INTENT, j -> NodeResult.advance(Stage.INTENT));

        TickResult result = router(4).tick(job.getId(), "api");

        assertThat(result.nodesRun()).isEqualTo(4);
        assertThat(result.stopReason()).isNull();
        assertThat(ComputedDocument.map(job.getComputed(), "graph")).containsEntry("stop_reason", "step_budget");
    }

    @Test
    void tick_illegalTransition_throws() {
        script.put(Stage.INTENT, j -> NodeResult.advance(Stage.VIDEO_FANOUT));

        assertThatThrownBy(() -> router(32).tick(job.getId(), "api"))
                .isInstanceOf(IllegalStateException.class);
        verify(jobRepo, never()).saveAndFlush(any());
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void tick_validationFailure_failsJob() {
        script.put(Stage.INTENT, j -> { throw WorkflowException.invalidInput("title is required"); });

        TickResult result = router(32).tick(job.getId(), "api");

        assertThat(result.status()).isEqualTo(JobStatus.FAILED);
        assertThat(result.stopReason()).isEqualTo(StopReason.DONE);
        assertThat(job.getErrorCode()).isEqualTo("INVALID_INPUT");
        verify(stepLog).record(eq(job.getId()), eq("intent"), eq(StepLog.FAILED), any());
        verify(jobRepo).saveAndFlush(job);
    }

    @Test
    void tick_unexpectedNodeError_rethrowsAndMarksJob() {
        script.put(Stage.INTENT, j -> { throw new IllegalArgumentException("bad provider list"); });

        assertThatThrownBy(() -> router(32).tick(job.getId(), "api"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad provider list");
        assertThat(job.getErrorCode()).isEqualTo("NODE_ERROR");
        assertThat(job.getStatus()).isNotEqualTo(JobStatus.FAILED);
    }

    @Test
    void tick_lostVersionRace_retriesFromFreshRead() {
        script.put(Stage.INTENT, j -> NodeResult.waitAt(Stage.INTENT));
        when(jobRepo.saveAndFlush(any()))
                .thenThrow(new OptimisticLockingFailureException("stale"))
                .thenThrow(new OptimisticLockingFailureException("stale"))
                .thenAnswer(inv -> inv.getArgument(0));

        TickResult result = router(32).tick(job.getId(), "api");

        assertThat(result.stopReason()).isEqualTo(StopReason.WAITING_PARALLEL);
        verify(jobRepo, times(3)).findById(job.getId());
    }

    @Test
    void tick_alwaysLosingRace_reportsConcurrency() {
        script.put(Stage.INTENT, j -> NodeResult.waitAt(Stage.INTENT));
        when(jobRepo.saveAndFlush(any())).thenThrow(new OptimisticLockingFailureException("stale"));

        assertThatThrownBy(() -> router(32).tick(job.getId(), "api"))
                .isInstanceOfSatisfying(WorkflowException.class,
                        e -> assertThat(e.getKind()).isEqualTo(WorkflowException.Kind.CONCURRENCY));
        verify(jobRepo, times(StageRouter.MAX_CAS_RETRIES)).findById(job.getId());
    }

    @Test
    void tick_unknownJob_throwsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(jobRepo.findById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> router(32).tick(unknown, "api")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void constructor_missingNode_rejected() {
        assertThatThrownBy(() -> new StageRouter(jobRepo, stepLog, txManager, meterRegistry,
                List.of(new ScriptedNode(Stage.INTENT)), 32))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No node registered");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StageRouter router(int budget) {
        List<StageNode> nodes = new ArrayList<>();
        for (Stage s : Stage.values()) nodes.add(new ScriptedNode(s));
        return new StageRouter(jobRepo, stepLog, txManager, meterRegistry, nodes, budget);
    }

    private final class ScriptedNode implements StageNode {
        private final Stage stage;

        ScriptedNode(Stage stage) { this.stage = stage; }

        @Override
        public Stage stage() { return stage; }

        @Override
        public NodeResult run(Job job) {
            return script.getOrDefault(stage, j -> NodeResult.waitAt(stage)).apply(job);
        }
    }
}
