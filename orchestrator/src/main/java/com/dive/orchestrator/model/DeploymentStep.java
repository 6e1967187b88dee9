package com.dive.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One attempt at running one phase for one instance.
 *
 * A retried phase produces one row per attempt, so this table answers
 * "what happened" while {@link Deployment} only answers "where are we now".
 *
 * DB table: deployment_steps
 */
@Entity
@Table(name = "deployment_steps")
public class DeploymentStep {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instance_code", nullable = false, updatable = false)
    private String instanceCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Phase phase;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepStatus status = StepStatus.PENDING;

    // Classified error code of a FAILED attempt.
    @Column(name = "error_code")
    private Integer errorCode;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    protected DeploymentStep() {}   // required by JPA

    public DeploymentStep(String instanceCode, Phase phase, int attempt, Instant startedAt) {
        this.instanceCode = instanceCode;
        this.phase        = phase;
        this.attempt      = attempt;
        this.startedAt    = startedAt;
    }

    public Long       getId()           { return id; }
    public String     getInstanceCode() { return instanceCode; }
    public Phase      getPhase()        { return phase; }
    public int        getAttempt()      { return attempt; }
    public StepStatus getStatus()       { return status; }
    public Integer    getErrorCode()    { return errorCode; }
    public Instant    getStartedAt()    { return startedAt; }
    public Instant    getFinishedAt()   { return finishedAt; }

    public void setStatus(StepStatus status)     { this.status = status; }
    public void setErrorCode(Integer errorCode)  { this.errorCode = errorCode; }
    public void setFinishedAt(Instant t)         { this.finishedAt = t; }
}
