package com.dive.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Externally consumed checkpoint report. Field names are part of the
 * contract with other tooling; do not rename.
 */
public record CheckpointReport(
        @JsonProperty("instance_code")   String instanceCode,
        @JsonProperty("deployment_type") String deploymentType,
        @JsonProperty("can_resume")      boolean canResume,
        @JsonProperty("next_phase")      String nextPhase,
        @JsonProperty("phases")          List<PhaseEntry> phases
) {
    public record PhaseEntry(
            @JsonProperty("phase")        String phase,
            @JsonProperty("completed_at") Instant completedAt,
            @JsonProperty("duration")     long duration
    ) {}
}
