package com.dive.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Durable completion marker for one (instance, phase).
 *
 * snapshot_path points at a copy of the instance's configuration directory
 * taken when the phase completed. Re-marking a phase overwrites the row and
 * the snapshot in place.
 *
 * DB table: checkpoints  (unique on instance_code + phase)
 */
@Entity
@Table(name = "checkpoints",
       uniqueConstraints = @UniqueConstraint(name = "uq_checkpoint_instance_phase",
                                             columnNames = {"instance_code", "phase"}))
public class Checkpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instance_code", nullable = false, updatable = false)
    private String instanceCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Phase phase;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "duration_seconds", nullable = false)
    private long durationSeconds;

    @Column(name = "snapshot_path", columnDefinition = "TEXT")
    private String snapshotPath;

    // JSON object; {"skipped":true} for phases a pipeline mode does not run.
    @Column(columnDefinition = "TEXT")
    private String data;

    protected Checkpoint() {}   // required by JPA

    public Checkpoint(String instanceCode, Phase phase) {
        this.instanceCode = instanceCode;
        this.phase        = phase;
    }

    public Long    getId()              { return id; }
    public String  getInstanceCode()    { return instanceCode; }
    public Phase   getPhase()           { return phase; }
    public Instant getCreatedAt()       { return createdAt; }
    public long    getDurationSeconds() { return durationSeconds; }
    public String  getSnapshotPath()    { return snapshotPath; }
    public String  getData()            { return data; }

    public void setCreatedAt(Instant createdAt)         { this.createdAt = createdAt; }
    public void setDurationSeconds(long seconds)        { this.durationSeconds = seconds; }
    public void setSnapshotPath(String snapshotPath)    { this.snapshotPath = snapshotPath; }
    public void setData(String data)                    { this.data = data; }
}
