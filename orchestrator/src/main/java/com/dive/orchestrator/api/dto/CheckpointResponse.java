package com.dive.orchestrator.api.dto;

import com.dive.orchestrator.model.Checkpoint;
import com.dive.orchestrator.model.Phase;

import java.time.Instant;

public record CheckpointResponse(
        Phase   phase,
        Instant createdAt,
        long    durationSeconds,
        String  snapshotPath,
        String  data
) {
    public static CheckpointResponse from(Checkpoint c) {
        return new CheckpointResponse(
                c.getPhase(),
                c.getCreatedAt(),
                c.getDurationSeconds(),
                c.getSnapshotPath(),
                c.getData()
        );
    }
}
