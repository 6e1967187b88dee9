package com.dive.orchestrator.scheduler;

import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.error.TransientInfraException;
import com.dive.orchestrator.process.ProcessResult;
import com.dive.orchestrator.process.ProcessRunner;
import com.dive.orchestrator.service.ConfigSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives an instance's services through {@code docker compose}, one
 * project per instance ({@code dive-<instance>}) using the compose file in
 * the instance's live configuration directory.
 */
@Component
public class DockerComposeServiceController implements ServiceController {

    private static final Logger log = LoggerFactory.getLogger(DockerComposeServiceController.class);

    private static final String COMPOSE_FILE = "docker-compose.yml";

    private final ProcessRunner       processRunner;
    private final ConfigSnapshotStore configDirs;
    private final Duration            timeout;

    public DockerComposeServiceController(ProcessRunner processRunner,
                                          ConfigSnapshotStore configDirs,
                                          @Value("${dive.orchestrator.compose-timeout:5m}") Duration timeout) {
        this.processRunner = processRunner;
        this.configDirs    = configDirs;
        this.timeout       = timeout;
    }

    @Override
    public void start(String instanceCode, ServiceNode service) {
        log.info("Starting {}/{}", instanceCode, service.name());
        ProcessResult result = compose(instanceCode, "up", "-d", "--no-deps", service.name());
        if (!result.succeeded()) {
            throw new TransientInfraException(ErrorCode.CONTAINER_START_FAILED,
                    "docker compose up " + service.name() + " failed for " + instanceCode
                    + (result.timedOut() ? " (timed out)" : " (exit " + result.exitCode() + "): " + result.lastLine()));
        }
    }

    @Override
    public void stopAll(String instanceCode) {
        if (!Files.exists(configDirs.liveDirectory(instanceCode).resolve(COMPOSE_FILE))) {
            log.info("No compose file for {}; nothing to stop", instanceCode);
            return;
        }
        log.warn("Stopping all services of {}", instanceCode);
        ProcessResult result = compose(instanceCode, "down", "--remove-orphans");
        if (!result.succeeded()) {
            throw new TransientInfraException(ErrorCode.STALE_CONTAINER_CLEANUP,
                    "docker compose down failed for " + instanceCode + ": " + result.lastLine());
        }
    }

    private ProcessResult compose(String instanceCode, String... args) {
        Path dir = configDirs.liveDirectory(instanceCode);
        List<String> command = new ArrayList<>(List.of(
                "docker", "compose",
                "-p", "dive-" + instanceCode,
                "-f", dir.resolve(COMPOSE_FILE).toString()));
        command.addAll(List.of(args));
        return processRunner.run(command, dir, timeout);
    }
}
