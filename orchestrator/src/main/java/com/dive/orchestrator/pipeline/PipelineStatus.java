package com.dive.orchestrator.pipeline;

/**
 * Outcome of one pipeline invocation.
 */
public enum PipelineStatus {
    COMPLETED,
    ALREADY_COMPLETE,
    FAILED,
    ROLLED_BACK,
    ROLLBACK_FAILED,
    ABORTED_THRESHOLD,
    LOCK_CONTENTION,
    REQUIRES_RESET;

    public boolean isSuccess() {
        return this == COMPLETED || this == ALREADY_COMPLETE;
    }
}
