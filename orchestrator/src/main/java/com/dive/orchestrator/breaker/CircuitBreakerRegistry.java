package com.dive.orchestrator.breaker;

import com.dive.orchestrator.error.CircuitOpenException;
import com.dive.orchestrator.error.ConfigurationException;
import com.dive.orchestrator.model.CircuitBreakerRecord;
import com.dive.orchestrator.model.CircuitState;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for guarded calls.
 *
 * Breakers are keyed by operation name ("keycloak-token", "terraform-apply",
 * ...) and shared by every instance pipeline. Counts:
 * <pre>
 *   dive.circuit.rejections{operation}
 *   dive.circuit.calls{operation, outcome="success|failure"}
 * </pre>
 */
@Component
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerStore store;
    private final MeterRegistry       meterRegistry;

    public CircuitBreakerRegistry(CircuitBreakerStore store, MeterRegistry meterRegistry) {
        this.store         = store;
        this.meterRegistry = meterRegistry;
    }

    public void init(String operation) {
        store.init(operation);
    }

    /**
     * Run {@code call} if the breaker lets it through and record the outcome.
     *
     * Configuration errors say nothing about the downstream dependency, so
     * they propagate without counting as a breaker failure; a HALF_OPEN trial
     * they interrupt is released for the next caller.
     *
     * @throws CircuitOpenException without invoking {@code call} while the breaker is open
     */
    public <T> T execute(String operation, Supplier<T> call) {
        try {
            store.acquirePermission(operation);
        } catch (CircuitOpenException e) {
            meterRegistry.counter("dive.circuit.rejections", "operation", operation).increment();
            log.warn("Call to '{}' short-circuited: {}", operation, e.getMessage());
            throw e;
        }

        T result;
        try {
            result = call.get();
        } catch (ConfigurationException e) {
            store.releaseTrial(operation);
            throw e;
        } catch (RuntimeException e) {
            store.recordFailure(operation);
            meterRegistry.counter("dive.circuit.calls", "operation", operation, "outcome", "failure").increment();
            throw e;
        }
        store.recordSuccess(operation);
        meterRegistry.counter("dive.circuit.calls", "operation", operation, "outcome", "success").increment();
        return result;
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    /** Stored state; CLOSED for an operation never seen. */
    public CircuitState getState(String operation) {
        return store.find(operation)
                .map(CircuitBreakerRecord::getState)
                .orElse(CircuitState.CLOSED);
    }

    public Optional<CircuitBreakerRecord> find(String operation) {
        return store.find(operation);
    }

    public void reset(String operation) {
        store.reset(operation);
    }

    /** Reset every breaker that is not CLOSED; returns the operations reset. */
    public List<String> resetAllOpen() {
        List<String> reset = store.findAll().stream()
                .filter(cb -> cb.getState() != CircuitState.CLOSED)
                .map(CircuitBreakerRecord::getOperationName)
                .toList();
        reset.forEach(store::reset);
        return reset;
    }

    public List<CircuitBreakerRecord> status() {
        return store.findAll();
    }
}
