package com.dive.orchestrator.api.dto;

import com.dive.orchestrator.model.OrchestrationError;

import java.time.Instant;

/**
 * A recorded error from the instance's error trail.
 * Severity runs from 1 (critical) to 5 (informational).
 */
public record ErrorResponse(
        int     errorCode,
        int     severity,
        String  source,
        String  message,
        String  remediation,
        String  context,
        Instant recordedAt
) {
    public static ErrorResponse from(OrchestrationError e) {
        return new ErrorResponse(
                e.getErrorCode(),
                e.getSeverity(),
                e.getSource(),
                e.getMessage(),
                e.getRemediation(),
                e.getContext(),
                e.getRecordedAt()
        );
    }
}
