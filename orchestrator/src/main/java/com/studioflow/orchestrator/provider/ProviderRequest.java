package com.studioflow.orchestrator.provider;

import com.studioflow.orchestrator.model.RunType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * What a worker sends to a provider: the run type plus the parameters the
 * enqueuing stage stored on the run's request column.
 */
public record ProviderRequest(
        UUID                jobId,
        RunType             runType,
        int                 variantIndex,
        int                 attempt,
        Map<String, Object> params
) {
    // Map.copyOf rejects null values, so optional parameters are dropped here.
    public ProviderRequest {
        params = params == null ? Map.of() : Map.copyOf(withoutNulls(params));
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> in) {
        Map<String, Object> out = new LinkedHashMap<>();
        in.forEach((k, v) -> { if (v != null) out.put(k, v); });
        return out;
    }
}
