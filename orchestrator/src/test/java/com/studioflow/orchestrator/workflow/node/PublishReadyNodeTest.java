package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.*;
import com.studioflow.orchestrator.repository.TrackRepository;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.WorkflowException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PublishReadyNodeTest {

    @Mock TrackRepository trackRepo;

    @Test
    void withTracks_succeedsJob() {
        Job job = job();
        when(trackRepo.findByJobId(job.getId()))
                .thenReturn(List.of(new Track(job.getId(), TrackType.VIDEO), new Track(job.getId(), TrackType.FULL_MIX)));

        NodeResult result = new PublishReadyNode(trackRepo).run(job);

        assertThat(result.stopReason()).isEqualTo(StopReason.DONE);
        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(ComputedDocument.map(job.getComputed(), "publish"))
                .containsEntry("tracks", List.of("FULL_MIX", "VIDEO"));
    }

    @Test
    void withoutTracks_isIntegrityFailure() {
        Job job = job();
        when(trackRepo.findByJobId(job.getId())).thenReturn(List.of());

        assertThatThrownBy(() -> new PublishReadyNode(trackRepo).run(job))
                .isInstanceOfSatisfying(WorkflowException.class,
                        e -> assertThat(e.getCode()).isEqualTo("NO_OUTPUTS"));
    }

    private static Job job() {
        return new Job(UUID.randomUUID(), Job.KIND_MUSIC_VIDEO, JobMode.AUTOPILOT, Map.of("title", "t"), "h");
    }
}
