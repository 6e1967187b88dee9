package com.dive.orchestrator.phase;

import com.dive.orchestrator.config.OrchestratorProperties;
import com.dive.orchestrator.error.ConfigurationException;
import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static map from {@link Phase} to the handler that does its work.
 *
 * Every {@link PhaseHandler} bean is collected through constructor
 * injection. Phases without a bean fall back to the external command
 * configured under {@code dive.orchestrator.phase-commands.<PHASE>}.
 * COMPLETE has no handler; the executor finishes the run itself.
 */
@Component
public class PhaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(PhaseRegistry.class);

    private final Map<Phase, PhaseHandler> handlers = new EnumMap<>(Phase.class);

    public PhaseRegistry(List<PhaseHandler> beans,
                         OrchestratorProperties properties,
                         ProcessRunner processRunner,
                         @Value("${dive.orchestrator.instances-root:./instances}") Path workingDir,
                         @Value("${dive.orchestrator.command-timeout:30m}") Duration commandTimeout) {
        for (PhaseHandler handler : beans) {
            PhaseHandler previous = handlers.put(handler.phase(), handler);
            if (previous != null) {
                throw new ConfigurationException(ErrorCode.PHASE_NOT_CONFIGURED,
                        "Two handlers for " + handler.phase() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
            log.info("Registered handler {} for phase {}", handler.getClass().getSimpleName(), handler.phase());
        }

        properties.phaseCommands().forEach((name, commandLine) -> {
            Phase phase = Phase.parse(name);
            if (handlers.containsKey(phase)) {
                log.warn("Phase {} has both a handler bean and a command; the bean wins", phase);
                return;
            }
            List<String> command = Arrays.stream(commandLine.trim().split("\\s+")).toList();
            handlers.put(phase, new CommandPhaseHandler(phase, command, processRunner, workingDir, commandTimeout));
            log.info("Registered command {} for phase {}", command, phase);
        });

        List<Phase> missing = Arrays.stream(Phase.values())
                .filter(p -> p != Phase.COMPLETE && !handlers.containsKey(p))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("No handler configured for phases {}; runs reaching them will fail", missing);
        }
    }

    /**
     * @throws ConfigurationException when nothing is registered for {@code phase}
     */
    public PhaseHandler get(Phase phase) {
        return find(phase).orElseThrow(() -> new ConfigurationException(ErrorCode.PHASE_NOT_CONFIGURED,
                "No handler registered for phase " + phase));
    }

    public Optional<PhaseHandler> find(Phase phase) {
        return Optional.ofNullable(handlers.get(phase));
    }
}
