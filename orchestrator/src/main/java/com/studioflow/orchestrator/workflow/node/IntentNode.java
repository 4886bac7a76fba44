package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.ComputedDocument;
import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import com.studioflow.orchestrator.workflow.WorkflowException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Rejects unusable input before anything is spent on providers. */
@Component
public class IntentNode implements StageNode {

    static final int MAX_TITLE_LENGTH = 200;
    static final Set<String> KNOWN_OUTPUTS = Set.of("audio", "video", "timed_lyrics");

    @Override
    public Stage stage() { return Stage.INTENT; }

    @Override
    public NodeResult run(Job job) {
        Map<String, Object> input = job.getInput();
        String title = ComputedDocument.string(input, "title");
        if (title == null) {
            throw WorkflowException.invalidInput("title is required");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw WorkflowException.invalidInput("title is longer than " + MAX_TITLE_LENGTH + " characters");
        }
        List<String> outputs = ComputedDocument.strings(input, "outputs");
        for (String o : outputs) {
            if (!KNOWN_OUTPUTS.contains(o)) {
                throw WorkflowException.invalidInput("unknown output '" + o + "'");
            }
        }

        Map<String, Object> intent = new LinkedHashMap<>();
        intent.put("title", title.trim());
        intent.put("mode", job.getMode().code());
        intent.put("outputs", outputs.isEmpty() ? List.of("audio", "video") : outputs);
        job.patchComputed(Map.of("intent", intent));
        return NodeResult.advance(Stage.PLAN);
    }
}
