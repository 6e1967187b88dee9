package com.dive.orchestrator.error;

/**
 * A phase reported an unrecoverable failure. Triggers immediate rollback.
 */
public class FatalDeploymentException extends OrchestrationException {

    public FatalDeploymentException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public FatalDeploymentException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
