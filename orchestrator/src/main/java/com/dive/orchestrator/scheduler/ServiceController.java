package com.dive.orchestrator.scheduler;

/**
 * Starts and stops the service processes of an instance.
 */
public interface ServiceController {

    /** Start one service without waiting for it to become healthy. */
    void start(String instanceCode, ServiceNode service);

    /** Halt and remove every service process of the instance. */
    void stopAll(String instanceCode);
}
