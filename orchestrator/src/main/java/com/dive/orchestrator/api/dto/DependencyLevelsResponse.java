package com.dive.orchestrator.api.dto;

import com.dive.orchestrator.scheduler.DependencyGraph;
import com.dive.orchestrator.scheduler.ServiceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup waves of the service graph. Services in one level start in
 * parallel; a level starts once the previous one is healthy.
 */
public record DependencyLevelsResponse(int maxLevel, List<Level> levels) {

    public record Level(int level, List<String> services) {}

    public static DependencyLevelsResponse from(DependencyGraph graph) {
        List<Level> levels = new ArrayList<>();
        for (int i = 0; i <= graph.maxLevel(); i++) {
            levels.add(new Level(i, graph.nodesAtLevel(i).stream().map(ServiceNode::name).sorted().toList()));
        }
        return new DependencyLevelsResponse(graph.maxLevel(), levels);
    }
}
