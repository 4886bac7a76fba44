package com.studioflow.orchestrator.candidate;

import com.studioflow.orchestrator.model.Candidate;
import com.studioflow.orchestrator.model.CandidateType;
import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class LyricsPromotion implements CandidatePromotion {

    @Override
    public CandidateType type() { return CandidateType.LYRICS; }

    @Override
    public Map<String, Object> promote(Job job, Candidate winner) {
        String text = ComputedDocument.string(winner.getContent(), "lyrics_text");
        if (text == null) {
            throw new CandidateSelectionException("Lyrics candidate " + winner.getId() + " has no lyrics_text");
        }
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("lyrics_text", text);
        patch.put("lyrics_source", "candidate");
        return patch;
    }
}
