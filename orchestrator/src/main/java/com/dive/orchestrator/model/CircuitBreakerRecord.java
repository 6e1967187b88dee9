package com.dive.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Durable state of one circuit breaker.
 *
 * Keyed by logical operation name ("keycloak-token", "terraform-apply", ...)
 * rather than by instance, so every instance pipeline shares the same view
 * of a downstream dependency. Rows are mutated only under a row lock
 * (see {@code CircuitBreakerRepository#lockByOperationName}).
 *
 * DB table: circuit_breakers
 */
@Entity
@Table(name = "circuit_breakers")
public class CircuitBreakerRecord {

    @Id
    @Column(name = "operation_name", length = 64)
    private String operationName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CircuitState state = CircuitState.CLOSED;

    // Failures inside the current rolling window.
    @Column(name = "failure_count", nullable = false)
    private int failureCount = 0;

    @Column(name = "success_count", nullable = false)
    private long successCount = 0;

    // Consecutive OPEN periods without a successful trial; drives the backoff.
    @Column(name = "open_count", nullable = false)
    private int openCount = 0;

    @Column(name = "window_started_at")
    private Instant windowStartedAt;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "retry_after")
    private Instant retryAfter;

    // Set while the single HALF_OPEN trial call is in flight.
    @Column(name = "trial_started_at")
    private Instant trialStartedAt;

    @Column(name = "last_failure_at")
    private Instant lastFailureAt;

    @Column(name = "last_success_at")
    private Instant lastSuccessAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CircuitBreakerRecord() {}   // required by JPA

    public CircuitBreakerRecord(String operationName, Instant now) {
        this.operationName = operationName;
        this.updatedAt     = now;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String       getOperationName()   { return operationName; }
    public CircuitState getState()           { return state; }
    public int          getFailureCount()    { return failureCount; }
    public long         getSuccessCount()    { return successCount; }
    public int          getOpenCount()       { return openCount; }
    public Instant      getWindowStartedAt() { return windowStartedAt; }
    public Instant      getOpenedAt()        { return openedAt; }
    public Instant      getRetryAfter()      { return retryAfter; }
    public Instant      getTrialStartedAt()  { return trialStartedAt; }
    public Instant      getLastFailureAt()   { return lastFailureAt; }
    public Instant      getLastSuccessAt()   { return lastSuccessAt; }
    public Instant      getUpdatedAt()       { return updatedAt; }

    public void setState(CircuitState state)           { this.state = state; }
    public void setFailureCount(int failureCount)      { this.failureCount = failureCount; }
    public void setOpenCount(int openCount)            { this.openCount = openCount; }
    public void setWindowStartedAt(Instant t)          { this.windowStartedAt = t; }
    public void setOpenedAt(Instant t)                 { this.openedAt = t; }
    public void setRetryAfter(Instant t)               { this.retryAfter = t; }
    public void setTrialStartedAt(Instant t)           { this.trialStartedAt = t; }
    public void setLastFailureAt(Instant t)            { this.lastFailureAt = t; }
    public void setLastSuccessAt(Instant t)            { this.lastSuccessAt = t; }
    public void setUpdatedAt(Instant t)                { this.updatedAt = t; }
    public void incrementSuccessCount()                { this.successCount++; }
}
