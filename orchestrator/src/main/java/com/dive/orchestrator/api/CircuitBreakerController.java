package com.dive.orchestrator.api;

import com.dive.orchestrator.api.dto.CircuitBreakerResponse;
import com.dive.orchestrator.breaker.CircuitBreakerRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * Operator view of the shared circuit breakers.
 *
 * GET  /circuit-breakers              all breakers
 * GET  /circuit-breakers/{op}         one breaker, 404 if it never ran
 * POST /circuit-breakers/{op}/reset   force CLOSED
 * POST /circuit-breakers/reset-open   force every non-CLOSED breaker CLOSED
 */
@RestController
@RequestMapping("/circuit-breakers")
public class CircuitBreakerController {

    private final CircuitBreakerRegistry breakers;

    public CircuitBreakerController(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @GetMapping
    public List<CircuitBreakerResponse> list() {
        return breakers.status().stream()
                .map(CircuitBreakerResponse::from)
                .toList();
    }

    @GetMapping("/{operation}")
    public CircuitBreakerResponse get(@PathVariable String operation) {
        return breakers.find(operation)
                .map(CircuitBreakerResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No circuit breaker: " + operation));
    }

    @PostMapping("/{operation}/reset")
    public CircuitBreakerResponse reset(@PathVariable String operation) {
        breakers.reset(operation);
        return breakers.find(operation)
                .map(CircuitBreakerResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.INTERNAL_SERVER_ERROR, "Breaker vanished after reset: " + operation));
    }

    @PostMapping("/reset-open")
    public Map<String, List<String>> resetOpen() {
        return Map.of("reset", breakers.resetAllOpen());
    }
}
