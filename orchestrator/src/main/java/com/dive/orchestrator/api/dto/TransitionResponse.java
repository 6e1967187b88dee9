package com.dive.orchestrator.api.dto;

import com.dive.orchestrator.model.DeploymentState;
import com.dive.orchestrator.model.StateTransition;

import java.time.Instant;

public record TransitionResponse(
        DeploymentState fromState,
        DeploymentState toState,
        String          reason,
        String          metadata,
        Instant         occurredAt
) {
    public static TransitionResponse from(StateTransition t) {
        return new TransitionResponse(
                t.getFromState(),
                t.getToState(),
                t.getReason(),
                t.getMetadata(),
                t.getOccurredAt()
        );
    }
}
