package com.dive.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Advisory per-instance lock row.
 *
 * The row exists only while a holder owns the instance. hold_count counts
 * re-entrant acquisitions by the same holder; expires_at bounds how long a
 * crashed holder can block later runs.
 *
 * Acquisition and release go through native upserts in
 * {@code DeploymentLockRepository}; this entity is used for reads.
 *
 * DB table: deployment_locks
 */
@Entity
@Table(name = "deployment_locks")
public class DeploymentLock {

    @Id
    @Column(name = "instance_code", length = 16)
    private String instanceCode;

    @Column(nullable = false)
    private String holder;

    @Column(name = "hold_count", nullable = false)
    private int holdCount;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected DeploymentLock() {}   // required by JPA

    public DeploymentLock(String instanceCode, String holder, int holdCount,
                          Instant acquiredAt, Instant expiresAt) {
        this.instanceCode = instanceCode;
        this.holder       = holder;
        this.holdCount    = holdCount;
        this.acquiredAt   = acquiredAt;
        this.expiresAt    = expiresAt;
    }

    public String  getInstanceCode() { return instanceCode; }
    public String  getHolder()       { return holder; }
    public int     getHoldCount()    { return holdCount; }
    public Instant getAcquiredAt()   { return acquiredAt; }
    public Instant getExpiresAt()    { return expiresAt; }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
