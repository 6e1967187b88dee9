package com.dive.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * The live state row of one hub or spoke instance.
 *
 * Exactly one row per instance code. Only the State Store writes it, and
 * always together with a {@link StateTransition} in the same transaction.
 *
 * DB table: deployment_states  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "deployment_states")
public class Deployment {

    @Id
    @Column(name = "instance_code", length = 16)
    private String instanceCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeploymentState state;

    // Free-form JSON supplied by the caller of setState.
    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Deployment() {}   // required by JPA

    public Deployment(String instanceCode, Instant now) {
        this.instanceCode = instanceCode;
        this.state        = DeploymentState.UNKNOWN;
        this.createdAt    = now;
        this.updatedAt    = now;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String          getInstanceCode() { return instanceCode; }
    public DeploymentState getState()        { return state; }
    public String          getMetadata()     { return metadata; }
    public Instant         getCreatedAt()    { return createdAt; }
    public Instant         getUpdatedAt()    { return updatedAt; }

    public void setState(DeploymentState state)  { this.state = state; }
    public void setMetadata(String metadata)     { this.metadata = metadata; }
    public void setUpdatedAt(Instant updatedAt)  { this.updatedAt = updatedAt; }
}
