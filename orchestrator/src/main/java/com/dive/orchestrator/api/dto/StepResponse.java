package com.dive.orchestrator.api.dto;

import com.dive.orchestrator.model.DeploymentStep;
import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.model.StepStatus;

import java.time.Instant;

/**
 * One phase attempt, returned by GET /instances/{code}/steps.
 * errorCode is set only for FAILED attempts.
 */
public record StepResponse(
        Phase      phase,
        int        attempt,
        StepStatus status,
        Integer    errorCode,
        Instant    startedAt,
        Instant    finishedAt
) {
    public static StepResponse from(DeploymentStep s) {
        return new StepResponse(
                s.getPhase(),
                s.getAttempt(),
                s.getStatus(),
                s.getErrorCode(),
                s.getStartedAt(),
                s.getFinishedAt()
        );
    }
}
