package com.studioflow.orchestrator.workflow.node;

import com.studioflow.orchestrator.model.Job;
import com.studioflow.orchestrator.model.Stage;
import com.studioflow.orchestrator.provider.ProviderRegistry;
import com.studioflow.orchestrator.workflow.NodeResult;
import com.studioflow.orchestrator.workflow.StageNode;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Fixes the provider lists the audio and video rounds will use. */
@Component
public class ProviderRouteNode implements StageNode {

    private final ProviderRegistry registry;

    public ProviderRouteNode(ProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Stage stage() { return Stage.PROVIDER_ROUTE; }

    @Override
    public NodeResult run(Job job) {
        job.patchComputed(Map.of(
                "audio_providers", ProviderChoice.resolve(job, "audio_providers", registry),
                "video_providers", ProviderChoice.resolve(job, "video_providers", registry)));
        return NodeResult.advance(Stage.AUDIO_FANOUT);
    }
}
