package com.studioflow.orchestrator.provider;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-process provider registry.
 *
 * All {@link Provider} beans are collected at startup via constructor
 * injection. Workers never call a provider directly; they go through
 * {@link #submit} and {@link #poll} so that every call is timed and
 * counted:
 * <pre>
 *   studioflow.provider.calls{provider, op="submit|poll", status="success|rejected|transport|timeout|bad_response|error"}
 *   studioflow.provider.duration{provider, op}
 * </pre>
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, Provider> providers = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public ProviderRegistry(List<Provider> allProviders, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Provider provider : allProviders) {
            Provider previous = providers.put(provider.name(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider name '" + provider.name() + "'");
            }
            log.info("Registered provider '{}' ({})", provider.name(), provider.getClass().getSimpleName());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Provider get(String name) {
        Provider provider = providers.get(name);
        if (provider == null) {
            throw new ProviderNotFoundException(name);
        }
        return provider;
    }

    public boolean contains(String name) {
        return providers.containsKey(name);
    }

    /** Returns all registered provider names (sorted). */
    public List<String> providerNames() {
        return providers.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented calls
    // ------------------------------------------------------------------

    public String submit(String providerName, ProviderRequest request, String idempotencyHint) {
        Provider provider = get(providerName);
        return instrumented(providerName, "submit", () -> provider.submit(request, idempotencyHint));
    }

    public ProviderPoll poll(String providerName, String providerJobId) {
        Provider provider = get(providerName);
        return instrumented(providerName, "poll", () -> provider.poll(providerJobId));
    }

    private <T> T instrumented(String providerName, String op, Supplier<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return call.get();
        } catch (ProviderException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (Exception e) {
            status = "error";
            throw new ProviderException(ProviderException.Kind.TRANSPORT,
                    "Unexpected error in provider '" + providerName + "' during " + op + ": " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("studioflow.provider.duration",
                    "provider", providerName, "op", op));
            meterRegistry.counter("studioflow.provider.calls",
                    "provider", providerName, "op", op, "status", status).increment();
        }
    }
}
