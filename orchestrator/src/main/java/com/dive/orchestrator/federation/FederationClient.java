package com.dive.orchestrator.federation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the federation drift service.
 *
 * The engine only consumes this API: it never detects or repairs drift
 * itself. Endpoints, relative to {@code dive.orchestrator.federation.base-url}:
 * <pre>
 *   GET  /health
 *   GET  /drift
 *   GET  /states
 *   POST /reconcile   {"instance_code": "..."}
 * </pre>
 */
@Component
public class FederationClient {

    private static final Logger log = LoggerFactory.getLogger(FederationClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final boolean      enabled;
    private final boolean      reconcileOnComplete;

    public FederationClient(HttpClient http,
                            ObjectMapper objectMapper,
                            @Value("${dive.orchestrator.federation.base-url:http://localhost:4000/api/drift}") String baseUrl,
                            @Value("${dive.orchestrator.federation.enabled:false}") boolean enabled,
                            @Value("${dive.orchestrator.federation.reconcile-on-complete:true}") boolean reconcileOnComplete) {
        this.http                = http;
        this.json                = objectMapper;
        this.baseUrl             = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.enabled             = enabled;
        this.reconcileOnComplete = reconcileOnComplete;
    }

    public boolean isEnabled() { return enabled; }

    /** Whether a finished pipeline should ask the drift service to reconcile. */
    public boolean reconcilesOnComplete() { return enabled && reconcileOnComplete; }

    // ------------------------------------------------------------------
    // Endpoints
    // ------------------------------------------------------------------

    public boolean health() {
        try {
            send(get("/health"), "health");
            return true;
        } catch (FederationException e) {
            log.debug("Federation service unhealthy: {}", e.getMessage());
            return false;
        }
    }

    public JsonNode drift() {
        return parse(send(get("/drift"), "drift"), "drift");
    }

    public JsonNode states() {
        return parse(send(get("/states"), "states"), "states");
    }

    /**
     * Ask the drift service to reconcile one instance.
     *
     * @throws FederationException on transport failure or non-2xx status
     */
    public JsonNode reconcile(String instanceCode) {
        log.info("Requesting federation reconcile for {}", instanceCode);
        String body;
        try {
            body = json.writeValueAsString(Map.of("instance_code", instanceCode));
        } catch (JsonProcessingException e) {
            throw new FederationException("JSON serialization failed", e);
        }
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/reconcile"))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return parse(send(req, "reconcile " + instanceCode), "reconcile");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET()
                .build();
    }

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new FederationException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (FederationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FederationException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new FederationException(opName + " failed", e);
        }
    }

    private JsonNode parse(String body, String opName) {
        try {
            return body == null || body.isBlank() ? json.createObjectNode() : json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FederationException("Failed to parse " + opName + " response", e);
        }
    }
}
