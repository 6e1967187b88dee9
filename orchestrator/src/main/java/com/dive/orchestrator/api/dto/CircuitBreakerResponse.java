package com.dive.orchestrator.api.dto;

import com.dive.orchestrator.model.CircuitBreakerRecord;
import com.dive.orchestrator.model.CircuitState;

import java.time.Instant;

public record CircuitBreakerResponse(
        String       operationName,
        CircuitState state,
        int          failureCount,
        long         successCount,
        int          openCount,
        Instant      retryAfter,
        Instant      lastFailureAt,
        Instant      lastSuccessAt
) {
    public static CircuitBreakerResponse from(CircuitBreakerRecord r) {
        return new CircuitBreakerResponse(
                r.getOperationName(),
                r.getState(),
                r.getFailureCount(),
                r.getSuccessCount(),
                r.getOpenCount(),
                r.getRetryAfter(),
                r.getLastFailureAt(),
                r.getLastSuccessAt()
        );
    }
}
