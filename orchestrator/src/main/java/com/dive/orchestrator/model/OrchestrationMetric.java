package com.dive.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One sample of a persisted time series.
 *
 * Names in use:
 *   service_startup_seconds:&lt;service&gt;  feeds the scheduler's dynamic timeouts
 *   phase_duration_seconds:&lt;phase&gt;     recorded after every completed phase
 *
 * DB table: orchestration_metrics
 */
@Entity
@Table(name = "orchestration_metrics")
public class OrchestrationMetric {

    public static final String SERVICE_STARTUP = "service_startup_seconds:";
    public static final String PHASE_DURATION  = "phase_duration_seconds:";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instance_code", nullable = false, updatable = false)
    private String instanceCode;

    @Column(name = "metric_name", nullable = false, updatable = false)
    private String metricName;

    @Column(nullable = false, updatable = false)
    private double value;

    @Column(nullable = false, updatable = false)
    private String unit;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    protected OrchestrationMetric() {}   // required by JPA

    public OrchestrationMetric(String instanceCode, String metricName, double value,
                               String unit, String metadata, Instant recordedAt) {
        this.instanceCode = instanceCode;
        this.metricName   = metricName;
        this.value        = value;
        this.unit         = unit;
        this.metadata     = metadata;
        this.recordedAt   = recordedAt;
    }

    public Long    getId()           { return id; }
    public String  getInstanceCode() { return instanceCode; }
    public String  getMetricName()   { return metricName; }
    public double  getValue()        { return value; }
    public String  getUnit()         { return unit; }
    public String  getMetadata()     { return metadata; }
    public Instant getRecordedAt()   { return recordedAt; }
}
