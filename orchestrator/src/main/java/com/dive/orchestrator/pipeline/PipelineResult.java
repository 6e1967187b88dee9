package com.dive.orchestrator.pipeline;

import com.dive.orchestrator.error.ErrorClassification;
import com.dive.orchestrator.model.Phase;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What an operator sees after a run: where it stopped, why, what to do
 * about it, and whether the remaining checkpoints allow a resume.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineResult(
        String         instanceCode,
        PipelineStatus status,
        Phase          failedPhase,
        Integer        errorCode,
        Integer        severity,
        String         remediation,
        String         message,
        boolean        resumable,
        long           durationSeconds
) {
    static PipelineResult success(String instanceCode, PipelineStatus status) {
        return new PipelineResult(instanceCode, status, null, null, null, null, null, false, 0);
    }

    static PipelineResult failure(String instanceCode, PipelineStatus status, Phase failedPhase,
                                  ErrorClassification classification, String message, boolean resumable) {
        return new PipelineResult(instanceCode, status, failedPhase,
                classification.code().code(),
                classification.severity().level(),
                classification.remediation(),
                message,
                resumable,
                0);
    }

    PipelineResult withDuration(long seconds) {
        return new PipelineResult(instanceCode, status, failedPhase, errorCode, severity,
                remediation, message, resumable, seconds);
    }
}
