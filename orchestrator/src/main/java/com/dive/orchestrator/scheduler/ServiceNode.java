package com.dive.orchestrator.scheduler;

import com.dive.orchestrator.config.OrchestratorProperties.ServiceDefinition;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * One service of the instance stack as seen by the scheduler.
 *
 * @param minTimeout lower bound for the dynamic startup timeout
 * @param maxTimeout upper bound, and the timeout used before any history exists
 * @param healthUrl  optional health endpoint; {instance} is substituted
 */
public record ServiceNode(
        String       name,
        List<String> dependsOn,
        Duration     minTimeout,
        Duration     maxTimeout,
        String       healthUrl
) {
    static final Duration DEFAULT_MIN = Duration.ofSeconds(30);
    static final Duration DEFAULT_MAX = Duration.ofSeconds(120);

    public ServiceNode {
        Objects.requireNonNull(name, "service name");
        dependsOn  = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        minTimeout = minTimeout == null ? DEFAULT_MIN : minTimeout;
        maxTimeout = maxTimeout == null ? DEFAULT_MAX : maxTimeout;
        if (maxTimeout.compareTo(minTimeout) < 0) {
            throw new IllegalArgumentException(
                    "Service " + name + ": max-timeout " + maxTimeout + " is below min-timeout " + minTimeout);
        }
    }

    public static ServiceNode of(String name, String... dependsOn) {
        return new ServiceNode(name, List.of(dependsOn), null, null, null);
    }

    public static ServiceNode from(ServiceDefinition def) {
        return new ServiceNode(def.name(), def.dependsOn(), def.minTimeout(), def.maxTimeout(), def.healthUrl());
    }
}
