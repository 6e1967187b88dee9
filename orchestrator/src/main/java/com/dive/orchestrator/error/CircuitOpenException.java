package com.dive.orchestrator.error;

import java.time.Instant;

/**
 * Call rejected without being attempted because the operation's breaker
 * is OPEN, or HALF_OPEN with its single trial already in flight.
 */
public class CircuitOpenException extends OrchestrationException {

    private final String  operationName;
    private final Instant retryAfter;

    public CircuitOpenException(String operationName, Instant retryAfter) {
        super(ErrorCode.CIRCUIT_OPEN,
                "Circuit '" + operationName + "' is open"
                + (retryAfter != null ? " until " + retryAfter : ""));
        this.operationName = operationName;
        this.retryAfter    = retryAfter;
    }

    public String  getOperationName() { return operationName; }
    public Instant getRetryAfter()    { return retryAfter; }
}
