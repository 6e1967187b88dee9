package com.dive.orchestrator.scheduler;

/**
 * Health check used while a service starts up. Must not block longer than
 * a single probe; the scheduler owns the polling loop and its deadline.
 */
public interface HealthProbe {

    boolean isHealthy(String instanceCode, ServiceNode service);
}
