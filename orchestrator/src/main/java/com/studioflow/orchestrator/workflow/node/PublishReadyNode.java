package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.JobStatus;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.model.Track;
import com.studioflow.orchestrator.repository.TrackRepository;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import com.studioflow.orchestrator.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Final integrity check: a finished job owns at least one promoted track. */
@Component
public class PublishReadyNode implements StageNode {

    private static final Logger log = LoggerFactory.getLogger(PublishReadyNode.class);

    private final TrackRepository trackRepo;

    public PublishReadyNode(TrackRepository trackRepo) {
        this.trackRepo = trackRepo;
    }

    @Override
    public Stage stage() { return Stage.PUBLISH_READY; }

    @Override
    public NodeResult run(Job job) {
        List<Track> tracks = trackRepo.findByJobId(job.getId());
        if (tracks.isEmpty()) {
            throw WorkflowException.noOutputs("job " + job.getId() + " finished without any track");
        }
        List<String> types = tracks.stream().map(t -> t.getTrackType().name()).sorted().toList();
        job.patchComputed(Map.of("publish", Map.of("tracks", types)));
        job.setStatus(JobStatus.SUCCEEDED);
        job.setProgress(Stage.PUBLISH_READY.progress());
        job.setErrorCode(null);
        job.setErrorMessage(null);
        log.info("Job {} ready with tracks {}", job.getId(), types);
        return NodeResult.done(Stage.PUBLISH_READY);
    }
}
