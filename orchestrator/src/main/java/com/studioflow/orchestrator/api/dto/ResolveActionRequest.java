package com.studioflow.orchestrator.api.dto;

import java.util.Map;

/** Request body for POST /jobs/{id}/actions/resolve: the computed patch answering the action. */
public record ResolveActionRequest(Map<String, Object> patch) {

    public ResolveActionRequest {
        if (patch == null) patch = Map.of();
    }
}
