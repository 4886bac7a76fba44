package com.studioflow.orchestrator.candidate;

import com.studioflow.orchestrator.model.Candidate;
import com.studioflow.orchestrator.model.CandidateType;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.TrackType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** The winning video is both the preview and the final cut until composition replaces it. */
@Component
public class VideoPromotion implements CandidatePromotion {

    private final TrackWriter tracks;

    public VideoPromotion(TrackWriter tracks) {
        this.tracks = tracks;
    }

    @Override
    public CandidateType type() { return CandidateType.VIDEO; }

    @Override
    public Map<String, Object> promote(Job job, Candidate winner) {
        if (winner.getMediaRef() == null) {
            throw new CandidateSelectionException("Video candidate " + winner.getId() + " has no media");
        }
        tracks.upsert(job.getId(), TrackType.VIDEO, winner.getMediaRef(), winner.getDurationMs(),
                winner.getId(), Map.of("provider", winner.getProvider(), "source", "candidate"));

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("preview_video_ref", winner.getMediaRef());
        patch.put("final_video_ref", winner.getMediaRef());
        return patch;
    }
}
