package com.dive.orchestrator.error;

/**
 * Another holder owns the instance lock and the wait timed out.
 */
public class LockContentionException extends OrchestrationException {

    public LockContentionException(String instanceCode) {
        super(ErrorCode.LOCK_CONTENTION, "Instance " + instanceCode + " is locked by another pipeline");
    }
}
