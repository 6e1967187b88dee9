package com.dive.orchestrator.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands (docker compose, phase scripts) with a deadline.
 *
 * stdout and stderr are merged and streamed to the log line by line. Only
 * the last {@code output-lines} lines (each cut at {@value #MAX_LINE_LENGTH}
 * chars) are kept for the {@link ProcessResult}. A command that outlives its timeout
 * is destroyed and reported with {@code timedOut = true}.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    static final int MAX_LINE_LENGTH = 4096;

    private final int outputLines;

    public ProcessRunner(@Value("${dive.orchestrator.process.output-lines:200}") int outputLines) {
        if (outputLines < 1) {
            throw new IllegalArgumentException("process.output-lines must be >= 1");
        }
        this.outputLines = outputLines;
    }

    public ProcessResult run(List<String> command, Path workingDir, Duration timeout) {
        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        if (workingDir != null && workingDir.toFile().isDirectory()) {
            pb.directory(workingDir.toFile());
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not start " + command.get(0), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process, command.get(0)));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command {} killed after {}", command, timeout);
                return new ProcessResult(command, -1, output.getNow(""), true);
            }
            return new ProcessResult(command, process.exitValue(), output.get(), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running " + command.get(0), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Could not read output of " + command.get(0), e.getCause());
        }
    }

    private String drain(Process process, String name) {
        Deque<String> tail = new ArrayDeque<>(outputLines);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[{}] {}", name, line);
                if (tail.size() == outputLines) {
                    tail.removeFirst();
                }
                tail.addLast(line.length() > MAX_LINE_LENGTH ? line.substring(0, MAX_LINE_LENGTH) : line);
            }
        } catch (IOException e) {
            // stream closes when a timed-out process is destroyed
            log.debug("Output of {} closed: {}", name, e.getMessage());
        }
        StringBuilder sb = new StringBuilder();
        for (String kept : tail) {
            sb.append(kept).append('\n');
        }
        return sb.toString();
    }
}
