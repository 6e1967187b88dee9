package com.dive.orchestrator.api;

import com.dive.orchestrator.federation.FederationClient;
import com.dive.orchestrator.federation.FederationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Read-only pass-through to the federation drift service.
 *
 * GET /federation/health   {"enabled": .., "healthy": ..}, never fails
 * GET /federation/drift    drift report, 503 when disabled, 502 when the service errors
 * GET /federation/states   per-instance federation states, same status mapping
 */
@RestController
@RequestMapping("/federation")
public class FederationController {

    private final FederationClient federation;

    public FederationController(FederationClient federation) {
        this.federation = federation;
    }

    @GetMapping("/health")
    public Map<String, Boolean> health() {
        boolean enabled = federation.isEnabled();
        return Map.of("enabled", enabled, "healthy", enabled && federation.health());
    }

    @GetMapping("/drift")
    public JsonNode drift() {
        return call(federation::drift);
    }

    @GetMapping("/states")
    public JsonNode states() {
        return call(federation::states);
    }

    private JsonNode call(Supplier<JsonNode> request) {
        if (!federation.isEnabled()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Federation integration is disabled");
        }
        try {
            return request.get();
        } catch (FederationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        }
    }
}
