package com.dive.orchestrator.scheduler;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Validated, acyclic service graph with precomputed dependency levels.
 * Only {@link DependencyScheduler#buildGraph} creates instances.
 */
public final class DependencyGraph {

    private final Map<String, ServiceNode> nodes;
    private final Map<String, Integer>     levels;
    private final List<List<ServiceNode>>  byLevel;

    DependencyGraph(Map<String, ServiceNode> nodes, Map<String, Integer> levels, List<List<ServiceNode>> byLevel) {
        this.nodes   = Collections.unmodifiableMap(nodes);
        this.levels  = Collections.unmodifiableMap(levels);
        this.byLevel = List.copyOf(byLevel);
    }

    public int level(String name) {
        Integer level = levels.get(name);
        if (level == null) {
            throw new IllegalArgumentException("Unknown service: " + name);
        }
        return level;
    }

    /** -1 for an empty graph. */
    public int maxLevel() {
        return byLevel.size() - 1;
    }

    /** Nodes at {@code level}, in declaration order; empty outside the graph's range. */
    public List<ServiceNode> nodesAtLevel(int level) {
        return level < 0 || level >= byLevel.size() ? List.of() : byLevel.get(level);
    }

    public ServiceNode node(String name) {
        ServiceNode node = nodes.get(name);
        if (node == null) {
            throw new IllegalArgumentException("Unknown service: " + name);
        }
        return node;
    }

    public int size() {
        return nodes.size();
    }

    public Map<String, Integer> levels() {
        return levels;
    }
}
