package com.dive.orchestrator.error;

import java.util.List;

/**
 * The service dependency graph contains a cycle. Raised while the graph is
 * built, before any service is started.
 */
public class DependencyCycleException extends ConfigurationException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super(ErrorCode.DEPENDENCY_CYCLE, "Dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** The nodes on the cycle, first node repeated at the end. */
    public List<String> getCycle() { return cycle; }
}
