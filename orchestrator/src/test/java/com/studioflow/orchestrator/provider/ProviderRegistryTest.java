package com.studioflow.orchestrator.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.RunType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRegistryTest {

    private SimpleMeterRegistry meterRegistry;
    private ProviderRegistry    registry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new ProviderRegistry(List.of(new NativeProvider(new ObjectMapper()), new BrokenProvider()), meterRegistry);
    }

    @Test
    void providerNames_sorted() {
        assertThat(registry.providerNames()).containsExactly("broken", "native");
        assertThat(registry.contains("native")).isTrue();
        assertThat(registry.contains("suno")).isFalse();
    }

    @Test
    void unknownProvider_throwsNotFound() {
        assertThatThrownBy(() -> registry.get("suno")).isInstanceOf(ProviderNotFoundException.class);
    }

    @Test
    void duplicateNames_rejected() {
        assertThatThrownBy(() -> new ProviderRegistry(List.of(new BrokenProvider(), new BrokenProvider()), meterRegistry))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void successfulCalls_counted() {
        String id = registry.submit("native", request(), "key-1");
        registry.poll("native", id);

        assertThat(meterRegistry.counter("studioflow.provider.calls",
                "provider", "native", "op", "submit", "status", "success").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("studioflow.provider.calls",
                "provider", "native", "op", "poll", "status", "success").count()).isEqualTo(1.0);
    }

    @Test
    void unexpectedProviderError_wrappedAsTransport() {
        assertThatThrownBy(() -> registry.submit("broken", request(), "key-1"))
                .isInstanceOfSatisfying(ProviderException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ProviderException.Kind.TRANSPORT));
        assertThat(meterRegistry.counter("studioflow.provider.calls",
                "provider", "broken", "op", "submit", "status", "error").count()).isEqualTo(1.0);
    }

    private static ProviderRequest request() {
        return new ProviderRequest(UUID.randomUUID(), RunType.LYRICS_CANDIDATE, 0, 1, Map.of("title", "t"));
    }

    private static final class BrokenProvider implements Provider {
        @Override public String name() { return "broken"; }
        @Override public String submit(ProviderRequest request, String idempotencyHint) { throw new NullPointerException("npe"); }
        @Override public ProviderPoll poll(String providerJobId) { return ProviderPoll.failed("broken"); }
    }
}
