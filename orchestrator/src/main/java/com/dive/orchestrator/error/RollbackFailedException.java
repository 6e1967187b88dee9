package com.dive.orchestrator.error;

/**
 * Restoring a checkpoint failed. The one unrecoverable case: the instance
 * is left in an unknown configuration and needs manual attention.
 */
public class RollbackFailedException extends OrchestrationException {

    public RollbackFailedException(String message, Throwable cause) {
        super(ErrorCode.ROLLBACK_FAILED, message, cause);
    }
}
