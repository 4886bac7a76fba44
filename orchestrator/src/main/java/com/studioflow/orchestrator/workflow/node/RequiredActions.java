package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.Job;

import java.util.Map;

/** Human actions a node can raise besides candidate picks. */
final class RequiredActions {

    static final String UPLOAD_AUDIO   = "upload_audio";
    static final String PROVIDE_LYRICS = "provide_lyrics";

    private RequiredActions() {}

    static void raise(Job job, String type, String message) {
        job.patchComputed(Map.of("required_action", Map.of("type", type, "message", message)));
    }
}
