package com.studioflow.orchestrator.queue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of executing one provider run, before it is written back.
 * {@code mediaRef} is the blob locator of any payload the provider returned.
 */
public record RunResult(
        boolean             succeeded,
        Map<String, Object> output,
        String              mediaRef,
        String              contentType,
        String              error,
        String              providerJobId
) {
    public RunResult {
        output = output == null ? Map.of() : output;
    }

    public static RunResult failed(String error, String providerJobId) {
        return new RunResult(false, Map.of(), null, null, error, providerJobId);
    }

    /** The JSON stored in provider_runs.response. */
    public Map<String, Object> response() {
        Map<String, Object> r = new LinkedHashMap<>(output);
        if (mediaRef != null)    r.put("media_ref", mediaRef);
        if (contentType != null) r.put("content_type", contentType);
        if (error != null)       r.put("error", error);
        return r;
    }
}
