package com.dive.orchestrator.error;

/**
 * An external system is temporarily unavailable: connection refused,
 * timeout, container not healthy yet. Retried under the circuit breaker.
 */
public class TransientInfraException extends OrchestrationException {

    public TransientInfraException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransientInfraException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
