package com.dive.orchestrator.phase;

import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.model.PipelineMode;

/**
 * The work of one deployment phase.
 *
 * Declare an implementation as a Spring {@code @Component} and the
 * {@link PhaseRegistry} picks it up. Signal failure by throwing: an
 * {@link com.dive.orchestrator.error.OrchestrationException} carrying the
 * right error code lets the classifier decide between retry and rollback;
 * anything else is classified as UNKNOWN and rolls back.
 *
 * Implementations must be idempotent: a phase interrupted by a crash is
 * run again from the start on resume.
 */
public interface PhaseHandler {

    Phase phase();

    void execute(String instanceCode, PipelineMode mode);
}
