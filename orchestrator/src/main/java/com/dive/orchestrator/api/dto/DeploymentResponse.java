package com.dive.orchestrator.api.dto;

import com.dive.orchestrator.model.Deployment;
import com.dive.orchestrator.model.DeploymentState;

import java.time.Instant;

/**
 * Response body for GET /instances and GET /instances/{code}/state.
 * An instance that was never deployed reports UNKNOWN with null timestamps.
 */
public record DeploymentResponse(
        String          instanceCode,
        DeploymentState state,
        long            durationSeconds,
        boolean         locked,
        Instant         createdAt,
        Instant         updatedAt
) {
    public static DeploymentResponse from(Deployment d, long durationSeconds, boolean locked) {
        return new DeploymentResponse(
                d.getInstanceCode(),
                d.getState(),
                durationSeconds,
                locked,
                d.getCreatedAt(),
                d.getUpdatedAt()
        );
    }

    public static DeploymentResponse unknown(String instanceCode, boolean locked) {
        return new DeploymentResponse(instanceCode, DeploymentState.UNKNOWN, 0, locked, null, null);
    }
}
