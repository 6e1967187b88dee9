package com.dive.orchestrator.phase;

import com.dive.orchestrator.config.OrchestratorProperties;
import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.model.PipelineMode;
import com.dive.orchestrator.scheduler.DependencyGraph;
import com.dive.orchestrator.scheduler.DependencyScheduler;
import com.dive.orchestrator.scheduler.ServiceNode;
import org.springframework.stereotype.Component;

/**
 * SERVICES: bring up the instance's service stack level by level.
 *
 * The graph is built when the bean is created, so a dependency cycle in
 * the configuration stops the application before any pipeline runs.
 */
@Component
public class ServicesPhaseHandler implements PhaseHandler {

    private final DependencyScheduler scheduler;
    private final DependencyGraph     graph;

    public ServicesPhaseHandler(DependencyScheduler scheduler, OrchestratorProperties properties) {
        this.scheduler = scheduler;
        this.graph     = scheduler.buildGraph(
                properties.services().stream().map(ServiceNode::from).toList());
    }

    @Override
    public Phase phase() { return Phase.SERVICES; }

    @Override
    public void execute(String instanceCode, PipelineMode mode) {
        scheduler.startServices(instanceCode, graph);
    }

    public DependencyGraph graph() { return graph; }
}
