package com.dive.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Structured part of the {@code dive.orchestrator} configuration tree.
 *
 * Scalar settings are injected with {@code @Value} where they are used;
 * only the service graph and the phase command table live here.
 */
@ConfigurationProperties(prefix = "dive.orchestrator")
public record OrchestratorProperties(
        List<ServiceDefinition> services,
        Map<String, String>     phaseCommands
) {

    public OrchestratorProperties {
        services      = services == null ? List.of() : List.copyOf(services);
        phaseCommands = phaseCommands == null ? Map.of() : Map.copyOf(phaseCommands);
    }

    /**
     * One service of the instance stack.
     *
     * @param healthUrl optional; {instance} is replaced by the instance code.
     *                  Without it the service counts as healthy once started.
     */
    public record ServiceDefinition(
            String       name,
            List<String> dependsOn,
            Duration     minTimeout,
            Duration     maxTimeout,
            String       healthUrl
    ) {
        public ServiceDefinition {
            dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        }
    }
}
