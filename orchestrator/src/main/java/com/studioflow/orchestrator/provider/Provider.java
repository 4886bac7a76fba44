package com.studioflow.orchestrator.provider;

/**
 * An external (or built-in) generator of lyrics, audio, video or analysis.
 *
 * Implementations are Spring {@code @Component}s and are picked up by
 * {@link ProviderRegistry} automatically. Synchronous providers may return
 * a terminal result on the first {@link #poll}.
 */
public interface Provider {

    /** Name stored on candidates and provider runs, e.g. {@code native}. */
    String name();

    /**
     * Start the work and return the provider's own job id.
     *
     * @param idempotencyHint the run's idempotency key; providers that
     *                        support it should deduplicate on it
     * @throws ProviderException when the provider refuses the request
     */
    String submit(ProviderRequest request, String idempotencyHint);

    /** Current state of a previously submitted job. */
    ProviderPoll poll(String providerJobId);
}
