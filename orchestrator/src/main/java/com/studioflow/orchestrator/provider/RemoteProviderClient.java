package com.studioflow.orchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studioflow.orchestrator.model.ComputedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP provider for generation services that speak the small job protocol
 * below. Only registered when {@code studioflow.remote-provider.base-url}
 * is set.
 *
 * <pre>
 *   POST {base}/jobs        {run_type, job_id, variant_index, attempt, params}
 *                           Idempotency-Key: {run idempotency key}
 *                           -> {"id": "..."}
 *   GET  {base}/jobs/{id}   -> {"status": "processing|succeeded|failed",
 *                               "output": {...}, "error": "...",
 *                               "payload_base64": "...", "content_type": "..."}
 * </pre>
 *
 * Blocking I/O is fine here: calls only happen on provider-run worker threads.
 */
@Component
@ConditionalOnProperty(name = "studioflow.remote-provider.base-url")
public class RemoteProviderClient implements Provider {

    private static final Logger log = LoggerFactory.getLogger(RemoteProviderClient.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       name;
    private final Duration     requestTimeout;

    public RemoteProviderClient(
            @Value("${studioflow.remote-provider.base-url}") String baseUrl,
            @Value("${studioflow.remote-provider.name:remote}") String name,
            @Value("${studioflow.remote-provider.request-timeout-sec:60}") int requestTimeoutSec,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.name           = name;
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSec);
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String name() { return name; }

    @Override
    public String submit(ProviderRequest request, String idempotencyHint) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_type", request.runType().code());
        body.put("job_id", request.jobId().toString());
        body.put("variant_index", request.variantIndex());
        body.put("attempt", request.attempt());
        body.put("params", request.params());

        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/jobs"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .header("Idempotency-Key", idempotencyHint)
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() >= 400 && resp.statusCode() < 500) {
                throw new ProviderException(ProviderException.Kind.REJECTED,
                        "submit rejected by '" + name + "' with HTTP " + resp.statusCode() + ": " + resp.body());
            }
            requireSuccess(resp, "submit");
            String id = ComputedDocument.string(parse(resp.body()), "id");
            if (id == null) {
                throw new ProviderException(ProviderException.Kind.BAD_RESPONSE,
                        "submit response from '" + name + "' has no id: " + resp.body());
            }
            log.info("Submitted {} to '{}' as {}", request.runType().code(), name, id);
            return id;
        } catch (ProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.TRANSPORT, "submit to '" + name + "' interrupted", e);
        } catch (Exception e) {
            throw new ProviderException(ProviderException.Kind.TRANSPORT, "submit to '" + name + "' failed", e);
        }
    }

    @Override
    public ProviderPoll poll(String providerJobId) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/jobs/" + URLEncoder.encode(providerJobId, StandardCharsets.UTF_8)))
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            requireSuccess(resp, "poll");
            return toPoll(parse(resp.body()));
        } catch (ProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.TRANSPORT, "poll of '" + name + "' interrupted", e);
        } catch (Exception e) {
            throw new ProviderException(ProviderException.Kind.TRANSPORT, "poll of '" + name + "' failed", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ProviderPoll toPoll(Map<String, Object> body) {
        String status = String.valueOf(body.getOrDefault("status", "")).toLowerCase(Locale.ROOT);
        Map<String, Object> output = ComputedDocument.map(body, "output");
        return switch (status) {
            case "queued", "running", "processing" -> ProviderPoll.processing();
            case "succeeded", "completed" -> {
                String encoded = ComputedDocument.string(body, "payload_base64");
                byte[] payload = encoded == null ? null : Base64.getDecoder().decode(encoded);
                yield new ProviderPoll(ProviderState.SUCCEEDED, output, payload,
                        ComputedDocument.string(body, "content_type"), null);
            }
            case "failed", "error" -> ProviderPoll.failed(
                    String.valueOf(body.getOrDefault("error", "provider reported failure")));
            default -> throw new ProviderException(ProviderException.Kind.BAD_RESPONSE,
                    "Unknown status '" + status + "' from '" + name + "'");
        };
    }

    private void requireSuccess(HttpResponse<String> resp, String op) {
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ProviderException(ProviderException.Kind.TRANSPORT,
                    op + " on '" + name + "' failed with HTTP " + resp.statusCode() + ": " + resp.body());
        }
    }

    private Map<String, Object> parse(String body) {
        try {
            return json.readValue(body, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.BAD_RESPONSE,
                    "Unreadable response from '" + name + "'", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.BAD_RESPONSE, "JSON serialization failed", e);
        }
    }
}
