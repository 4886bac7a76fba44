package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.candidate.CandidateController;
import com.studioflow.orchestrator.candidate.FanInOutcome;
import com.studioflow.orchestrator.candidate.FanInResult;
import com.studioflow.orchestrator.model.*;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.WorkflowException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateFanInNodeTest {

    @Mock CandidateController controller;

    private CandidateFanInNode node;
    private Job job;

    @BeforeEach
    void setUp() {
        node = new CandidateFanInNode(Stage.AUDIO_FANIN, Stage.AUDIO_FANOUT, Stage.ALIGN_LYRICS,
                CandidateType.AUDIO, controller);
        job = new Job(UUID.randomUUID(), Job.KIND_MUSIC_VIDEO, JobMode.AUTOPILOT, Map.of("title", "t"), "h");
    }

    @Test
    void waiting_staysPut() {
        outcome(FanInOutcome.WAITING_PARALLEL);
        assertThat(node.run(job)).isEqualTo(NodeResult.waitAt(Stage.AUDIO_FANIN));
    }

    @Test
    void actionRequired_pauses() {
        outcome(FanInOutcome.ACTION_REQUIRED);
        assertThat(node.run(job)).isEqualTo(NodeResult.pauseAt(Stage.AUDIO_FANIN));
    }

    @Test
    void retryOrMissingGroup_goesBackToFanOut() {
        outcome(FanInOutcome.RETRY);
        assertThat(node.run(job).next()).isEqualTo(Stage.AUDIO_FANOUT);

        outcome(FanInOutcome.NO_GROUP);
        assertThat(node.run(job).next()).isEqualTo(Stage.AUDIO_FANOUT);
    }

    @Test
    void chosen_movesOn() {
        outcome(FanInOutcome.CHOSEN);
        assertThat(node.run(job)).isEqualTo(NodeResult.advance(Stage.ALIGN_LYRICS));
    }

    @Test
    void exhausted_failsJob() {
        outcome(FanInOutcome.EXHAUSTED);
        assertThatThrownBy(() -> node.run(job))
                .isInstanceOfSatisfying(WorkflowException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(CandidateFanInNode.EXHAUSTED_CODE);
                    assertThat(e.failsJob()).isTrue();
                });
    }

    private void outcome(FanInOutcome outcome) {
        when(controller.fanIn(job, CandidateType.AUDIO))
                .thenReturn(new FanInResult(outcome, UUID.randomUUID(), 1, null));
    }
}
