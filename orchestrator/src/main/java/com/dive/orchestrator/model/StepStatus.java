package com.dive.orchestrator.model;

/**
 * Status of a single phase attempt.
 *
 *   PENDING → IN_PROGRESS → COMPLETED | FAILED
 */
public enum StepStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
