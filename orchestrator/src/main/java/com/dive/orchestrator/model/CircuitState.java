package com.dive.orchestrator.model;

/**
 * Circuit breaker states.
 *
 * Transitions:
 *   CLOSED    → OPEN      (failure threshold reached within the window)
 *   OPEN      → HALF_OPEN (retry_after elapsed, next caller gets the trial)
 *   HALF_OPEN → CLOSED    (trial succeeded)
 *   HALF_OPEN → OPEN      (trial failed, longer backoff)
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
