package com.studioflow.orchestrator.provider;

import java.util.Map;

/**
 * Result of polling a provider job.
 *
 * {@code payload} carries media bytes when the provider returns them
 * inline; the worker moves them into the blob store and keeps only the
 * locator.
 */
public record ProviderPoll(
        ProviderState       state,
        Map<String, Object> output,
        byte[]              payload,
        String              contentType,
        String              error
) {
    public ProviderPoll {
        output = output == null ? Map.of() : output;
    }

    public static ProviderPoll processing() {
        return new ProviderPoll(ProviderState.PROCESSING, Map.of(), null, null, null);
    }

    public static ProviderPoll succeeded(Map<String, Object> output) {
        return new ProviderPoll(ProviderState.SUCCEEDED, output, null, null, null);
    }

    public static ProviderPoll succeeded(Map<String, Object> output, byte[] payload, String contentType) {
        return new ProviderPoll(ProviderState.SUCCEEDED, output, payload, contentType, null);
    }

    public static ProviderPoll failed(String error) {
        return new ProviderPoll(ProviderState.FAILED, Map.of(), null, null, error);
    }

    public boolean hasPayload() {
        return payload != null && payload.length > 0;
    }
}
