package com.dive.orchestrator.scheduler;

import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.error.TransientInfraException;
import com.dive.orchestrator.process.ProcessResult;
import com.dive.orchestrator.process.ProcessRunner;
import com.dive.orchestrator.service.ConfigSnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DockerComposeServiceControllerTest {

    @Mock ProcessRunner processRunner;

    @TempDir Path instances;
    @TempDir Path snapshots;

    DockerComposeServiceController controller;

    @BeforeEach
    void setUp() {
        controller = new DockerComposeServiceController(processRunner,
                new ConfigSnapshotStore(instances, snapshots), Duration.ofMinutes(1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void start_runsComposeUpForOneServiceInInstanceProject() {
        when(processRunner.run(any(), any(), any()))
                .thenReturn(new ProcessResult(List.of(), 0, "", false));

        controller.start("fra", ServiceNode.of("keycloak", "postgres"));

        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(processRunner).run(command.capture(), eq(instances.resolve("fra")), eq(Duration.ofMinutes(1)));
        assertThat(command.getValue())
                .containsSequence("docker", "compose", "-p", "dive-fra")
                .endsWith("up", "-d", "--no-deps", "keycloak");
    }

    @Test
    void start_nonZeroExit_isTransientStartFailure() {
        when(processRunner.run(any(), any(), any()))
                .thenReturn(new ProcessResult(List.of(), 1, "pulling\nimage not found\n", false));

        assertThatThrownBy(() -> controller.start("fra", ServiceNode.of("kas")))
                .isInstanceOf(TransientInfraException.class)
                .hasMessageContaining("image not found")
                .satisfies(e -> assertThat(((TransientInfraException) e).getErrorCode())
                        .isEqualTo(ErrorCode.CONTAINER_START_FAILED));
    }

    @Test
    void stopAll_withoutComposeFile_doesNothing() {
        controller.stopAll("gbr");

        verifyNoInteractions(processRunner);
    }

    @Test
    void stopAll_runsComposeDown() throws Exception {
        Files.createDirectories(instances.resolve("fra"));
        Files.writeString(instances.resolve("fra/docker-compose.yml"), "services: {}\n");
        when(processRunner.run(any(), any(), any()))
                .thenReturn(new ProcessResult(List.of(), 0, "", false));

        controller.stopAll("fra");

        verify(processRunner).run(argThat(cmd -> cmd.contains("down") && cmd.contains("--remove-orphans")),
                any(), any());
    }

    @Test
    void stopAll_failure_isReportedAsCleanupError() throws Exception {
        Files.createDirectories(instances.resolve("fra"));
        Files.writeString(instances.resolve("fra/docker-compose.yml"), "services: {}\n");
        when(processRunner.run(any(), any(), any()))
                .thenReturn(new ProcessResult(List.of(), 0, "", true));

        assertThatThrownBy(() -> controller.stopAll("fra"))
                .isInstanceOf(TransientInfraException.class)
                .satisfies(e -> assertThat(((TransientInfraException) e).getErrorCode())
                        .isEqualTo(ErrorCode.STALE_CONTAINER_CLEANUP));
    }
}
