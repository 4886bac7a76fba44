package com.studioflow.orchestrator.candidate;

import com.studioflow.orchestrator.model.Candidate;
import com.studioflow.orchestrator.model.CandidateType;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.TrackType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** The winning audio becomes the job's full mix. */
@Component
public class AudioPromotion implements CandidatePromotion {

    private final TrackWriter tracks;

    public AudioPromotion(TrackWriter tracks) {
        this.tracks = tracks;
    }

    @Override
    public CandidateType type() { return CandidateType.AUDIO; }

    @Override
    public Map<String, Object> promote(Job job, Candidate winner) {
        if (winner.getMediaRef() == null) {
            throw new CandidateSelectionException("Audio candidate " + winner.getId() + " has no media");
        }
        tracks.upsert(job.getId(), TrackType.FULL_MIX, winner.getMediaRef(), winner.getDurationMs(),
                winner.getId(), Map.of("provider", winner.getProvider(), "source", "candidate"));

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("audio_master_ref", winner.getMediaRef());
        patch.put("audio_master_duration_ms", winner.getDurationMs());
        patch.put("audio_master_candidate_id", winner.getId().toString());
        return patch;
    }
}
