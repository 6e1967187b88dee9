package com.dive.orchestrator.error;

/**
 * Retry category of an {@link ErrorCode}.
 *
 * TRANSIENT and RECOVERABLE errors are retried by the pipeline; PERMANENT
 * and UNKNOWN errors go straight to rollback.
 */
public enum ErrorCategory {
    TRANSIENT,
    RECOVERABLE,
    PERMANENT,
    UNKNOWN;

    public boolean isRecoverable() {
        return this == TRANSIENT || this == RECOVERABLE;
    }
}
