package com.dive.orchestrator.federation;

import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.error.OrchestrationException;

/**
 * Thrown when the federation drift API returns an error or is unreachable.
 */
public class FederationException extends OrchestrationException {

    public FederationException(String message) {
        super(ErrorCode.FEDERATION_SYNC_FAILED, message);
    }

    public FederationException(String message, Throwable cause) {
        super(ErrorCode.FEDERATION_SYNC_FAILED, message, cause);
    }
}
