package com.dive.orchestrator.scheduler;

import com.dive.orchestrator.error.ConfigurationException;
import com.dive.orchestrator.error.DependencyCycleException;
import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.error.OrchestrationException;
import com.dive.orchestrator.error.TransientInfraException;
import com.dive.orchestrator.model.OrchestrationMetric;
import com.dive.orchestrator.repository.MetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Dependency-aware service startup.
 *
 * <p>{@link #buildGraph} validates the declared service graph (DFS cycle
 * detection) and assigns levels: 0 for a service without dependencies,
 * otherwise one more than its deepest dependency.
 *
 * <p>{@link #startServices} walks the levels in order. All services of a
 * level start and are health-polled in parallel, one thread per service;
 * the next level starts only when every service of the current level is
 * healthy. One service missing its deadline fails the whole level.
 *
 * <p>Deadlines come from {@link #dynamicTimeout}: the P95 of recorded
 * startup durations times a safety margin, clamped to the service's
 * [min, max] bounds.
 */
@Component
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    private final MetricRepository  metricRepo;
    private final ServiceController controller;
    private final HealthProbe       healthProbe;
    private final Clock             clock;
    private final double            safetyMargin;
    private final int               historySize;
    private final Duration          pollInitial;
    private final Duration          pollMax;

    public DependencyScheduler(MetricRepository metricRepo,
                               ServiceController controller,
                               HealthProbe healthProbe,
                               Clock clock,
                               @Value("${dive.orchestrator.scheduler.safety-margin:1.5}") double safetyMargin,
                               @Value("${dive.orchestrator.scheduler.history-size:50}") int historySize,
                               @Value("${dive.orchestrator.scheduler.poll-initial:1s}") Duration pollInitial,
                               @Value("${dive.orchestrator.scheduler.poll-max:10s}") Duration pollMax) {
        this.metricRepo   = metricRepo;
        this.controller   = controller;
        this.healthProbe  = healthProbe;
        this.clock        = clock;
        this.safetyMargin = safetyMargin;
        this.historySize  = historySize;
        this.pollInitial  = pollInitial;
        this.pollMax      = pollMax;
    }

    // ------------------------------------------------------------------
    // Graph construction
    // ------------------------------------------------------------------

    /**
     * @throws DependencyCycleException if any dependency chain loops back on itself
     * @throws ConfigurationException   on duplicate names or undeclared dependencies
     */
    public DependencyGraph buildGraph(Collection<ServiceNode> services) {
        Map<String, ServiceNode> nodes = new LinkedHashMap<>();
        for (ServiceNode node : services) {
            if (nodes.put(node.name(), node) != null) {
                throw new ConfigurationException(ErrorCode.INSTANCE_CONFIG_INVALID,
                        "Service declared twice: " + node.name());
            }
        }
        for (ServiceNode node : nodes.values()) {
            for (String dep : node.dependsOn()) {
                if (!nodes.containsKey(dep)) {
                    throw new ConfigurationException(ErrorCode.INSTANCE_CONFIG_INVALID,
                            "Service " + node.name() + " depends on undeclared service " + dep);
                }
            }
        }

        Map<String, Integer> levels = new HashMap<>();
        Map<String, Boolean> onPath = new HashMap<>();
        for (String name : nodes.keySet()) {
            visit(name, nodes, levels, onPath, new ArrayDeque<>());
        }

        List<List<ServiceNode>> byLevel = new ArrayList<>();
        for (ServiceNode node : nodes.values()) {
            int level = levels.get(node.name());
            while (byLevel.size() <= level) byLevel.add(new ArrayList<>());
            byLevel.get(level).add(node);
        }
        byLevel.replaceAll(List::copyOf);

        log.info("Dependency graph: {} services on {} levels", nodes.size(), byLevel.size());
        return new DependencyGraph(nodes, levels, byLevel);
    }

    /** Depth-first; a node met again while still on the current path closes a cycle. */
    private int visit(String name, Map<String, ServiceNode> nodes, Map<String, Integer> levels,
                      Map<String, Boolean> onPath, Deque<String> path) {
        Integer known = levels.get(name);
        if (known != null) return known;
        if (Boolean.TRUE.equals(onPath.get(name))) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String p : (Iterable<String>) path::descendingIterator) {
                if (p.equals(name)) inCycle = true;
                if (inCycle) cycle.add(p);
            }
            cycle.add(name);
            throw new DependencyCycleException(cycle);
        }

        onPath.put(name, true);
        path.push(name);
        int level = 0;
        for (String dep : nodes.get(name).dependsOn()) {
            level = Math.max(level, visit(dep, nodes, levels, onPath, path) + 1);
        }
        path.pop();
        onPath.put(name, false);
        levels.put(name, level);
        return level;
    }

    // ------------------------------------------------------------------
    // Timeouts
    // ------------------------------------------------------------------

    /**
     * P95 of the recent startup durations of {@code service} times the
     * safety margin, clamped to [min, max]. Without history: max.
     */
    public Duration dynamicTimeout(ServiceNode service) {
        List<Double> samples = metricRepo.findRecentValues(
                OrchestrationMetric.SERVICE_STARTUP + service.name(), PageRequest.of(0, historySize));
        if (samples.isEmpty()) {
            return service.maxTimeout();
        }
        double p95 = percentile(samples, 0.95);
        Duration computed = Duration.ofMillis(Math.round(p95 * safetyMargin * 1000));
        if (computed.compareTo(service.minTimeout()) < 0) return service.minTimeout();
        if (computed.compareTo(service.maxTimeout()) > 0) return service.maxTimeout();
        return computed;
    }

    /** Nearest-rank percentile. */
    static double percentile(List<Double> values, double p) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(null);
        int rank = (int) Math.ceil(p * sorted.size());
        return sorted.get(Math.max(0, rank - 1));
    }

    // ------------------------------------------------------------------
    // Startup
    // ------------------------------------------------------------------

    /**
     * Start every service of the graph level by level.
     *
     * @return startup duration per service
     * @throws OrchestrationException from the first service of a level that
     *         failed to start or missed its deadline; later levels are not started
     */
    public Map<String, Duration> startServices(String instanceCode, DependencyGraph graph) {
        Map<String, Duration> startup = new LinkedHashMap<>();
        for (int level = 0; level <= graph.maxLevel(); level++) {
            List<ServiceNode> nodes = graph.nodesAtLevel(level);
            log.info("Starting level {} of {} for {}: {}", level, graph.maxLevel(), instanceCode,
                    nodes.stream().map(ServiceNode::name).toList());
            startup.putAll(startLevel(instanceCode, level, nodes));
        }
        return startup;
    }

    private Map<String, Duration> startLevel(String instanceCode, int level, List<ServiceNode> nodes) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        ExecutorService pool = Executors.newFixedThreadPool(nodes.size());
        try {
            CompletionService<Map.Entry<String, Duration>> completion = new ExecutorCompletionService<>(pool);
            for (ServiceNode node : nodes) {
                completion.submit(() -> {
                    if (mdc != null) MDC.setContextMap(mdc);
                    try {
                        return Map.entry(node.name(), startAndAwait(instanceCode, node));
                    } finally {
                        MDC.clear();
                    }
                });
            }

            Map<String, Duration> started = new LinkedHashMap<>();
            for (int i = 0; i < nodes.size(); i++) {
                Future<Map.Entry<String, Duration>> done = completion.take();
                Map.Entry<String, Duration> entry = done.get();
                started.put(entry.getKey(), entry.getValue());
            }
            return started;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Level {} failed for {}: {}", level, instanceCode, cause.getMessage());
            if (cause instanceof OrchestrationException oe) throw oe;
            throw new TransientInfraException(ErrorCode.CONTAINER_START_FAILED,
                    "Level " + level + " startup failed for " + instanceCode, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientInfraException(ErrorCode.HEALTH_CHECK_TIMEOUT,
                    "Interrupted while starting level " + level + " for " + instanceCode, e);
        } finally {
            pool.shutdownNow();
        }
    }

    /** Start one service and poll its health with backoff until healthy or past its deadline. */
    private Duration startAndAwait(String instanceCode, ServiceNode node) throws InterruptedException {
        Duration timeout = dynamicTimeout(node);
        long started = System.nanoTime();
        long deadline = started + timeout.toNanos();

        controller.start(instanceCode, node);

        Duration delay = pollInitial;
        while (true) {
            if (healthProbe.isHealthy(instanceCode, node)) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                recordStartup(instanceCode, node, elapsed);
                log.info("{}/{} healthy after {} ms (timeout {} s)",
                        instanceCode, node.name(), elapsed.toMillis(), timeout.toSeconds());
                return elapsed;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TransientInfraException(ErrorCode.HEALTH_CHECK_TIMEOUT,
                        node.name() + " not healthy within " + timeout.toSeconds() + "s for " + instanceCode);
            }
            Thread.sleep(Math.max(1, Math.min(delay.toMillis(), Duration.ofNanos(remaining).toMillis())));
            Duration doubled = delay.multipliedBy(2);
            delay = doubled.compareTo(pollMax) > 0 ? pollMax : doubled;
        }
    }

    private void recordStartup(String instanceCode, ServiceNode node, Duration elapsed) {
        metricRepo.save(new OrchestrationMetric(
                instanceCode,
                OrchestrationMetric.SERVICE_STARTUP + node.name(),
                elapsed.toMillis() / 1000.0,
                "seconds",
                null,
                clock.instant()));
    }
}
