package com.dive.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One entry of the append-only transition log.
 *
 * Never updated or deleted. Rollbacks are recorded as new transitions.
 *
 * DB table: state_transitions
 */
@Entity
@Table(name = "state_transitions")
public class StateTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instance_code", nullable = false, updatable = false)
    private String instanceCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", nullable = false, updatable = false)
    private DeploymentState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, updatable = false)
    private DeploymentState toState;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    protected StateTransition() {}   // required by JPA

    public StateTransition(String instanceCode, DeploymentState fromState, DeploymentState toState,
                           String reason, String metadata, Instant occurredAt) {
        this.instanceCode = instanceCode;
        this.fromState    = fromState;
        this.toState      = toState;
        this.reason       = reason;
        this.metadata     = metadata;
        this.occurredAt   = occurredAt;
    }

    public Long            getId()           { return id; }
    public String          getInstanceCode() { return instanceCode; }
    public DeploymentState getFromState()    { return fromState; }
    public DeploymentState getToState()      { return toState; }
    public String          getReason()       { return reason; }
    public String          getMetadata()     { return metadata; }
    public Instant         getOccurredAt()   { return occurredAt; }
}
