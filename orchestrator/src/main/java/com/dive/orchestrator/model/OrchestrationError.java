package com.dive.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Append-only audit record of an error seen by the engine.
 *
 * Written before any retry or rollback decision is taken on the error.
 *
 * DB table: orchestration_errors
 */
@Entity
@Table(name = "orchestration_errors")
public class OrchestrationError {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instance_code", nullable = false, updatable = false)
    private String instanceCode;

    @Column(name = "error_code", nullable = false, updatable = false)
    private int errorCode;

    // 1 = critical ... 5 = informational
    @Column(nullable = false, updatable = false)
    private int severity;

    @Column(nullable = false, updatable = false)
    private String source;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String message;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String remediation;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String context;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    protected OrchestrationError() {}   // required by JPA

    public OrchestrationError(String instanceCode, int errorCode, int severity, String source,
                              String message, String remediation, String context, Instant recordedAt) {
        this.instanceCode = instanceCode;
        this.errorCode    = errorCode;
        this.severity     = severity;
        this.source       = source;
        this.message      = message;
        this.remediation  = remediation;
        this.context      = context;
        this.recordedAt   = recordedAt;
    }

    public Long    getId()           { return id; }
    public String  getInstanceCode() { return instanceCode; }
    public int     getErrorCode()    { return errorCode; }
    public int     getSeverity()     { return severity; }
    public String  getSource()       { return source; }
    public String  getMessage()      { return message; }
    public String  getRemediation()  { return remediation; }
    public String  getContext()      { return context; }
    public Instant getRecordedAt()   { return recordedAt; }
}
