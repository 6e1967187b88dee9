package com.dive.orchestrator.phase;

import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.error.FatalDeploymentException;
import com.dive.orchestrator.error.TransientInfraException;
import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.model.PipelineMode;
import com.dive.orchestrator.process.ProcessResult;
import com.dive.orchestrator.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phase backed by an external command, invoked as
 * {@code <command...> <instance_code> <mode>}.
 *
 * Exit status contract:
 * <pre>
 *   0            success
 *   75           temporary failure (EX_TEMPFAIL), retried
 *   other        failure; classified by the last "DIVE_ERROR=<code>" line
 *                the command printed, or PHASE_FATAL without one
 *   timeout      OPERATION_TIMEOUT, retried
 * </pre>
 */
public class CommandPhaseHandler implements PhaseHandler {

    private static final Logger log = LoggerFactory.getLogger(CommandPhaseHandler.class);

    static final int EX_TEMPFAIL = 75;

    private static final Pattern ERROR_LINE = Pattern.compile("(?m)^DIVE_ERROR=(\\d{4})\\s*$");

    private final Phase         phase;
    private final List<String>  command;
    private final ProcessRunner processRunner;
    private final Path          workingDir;
    private final Duration      timeout;

    public CommandPhaseHandler(Phase phase, List<String> command, ProcessRunner processRunner,
                               Path workingDir, Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Empty command for phase " + phase);
        }
        this.phase         = phase;
        this.command       = List.copyOf(command);
        this.processRunner = processRunner;
        this.workingDir    = workingDir;
        this.timeout       = timeout;
    }

    @Override
    public Phase phase() { return phase; }

    List<String> command() { return command; }

    @Override
    public void execute(String instanceCode, PipelineMode mode) {
        List<String> argv = new ArrayList<>(command);
        argv.add(instanceCode);
        argv.add(mode.argument());

        log.info("Running {} for {}: {}", phase, instanceCode, argv);
        ProcessResult result = processRunner.run(argv, workingDir, timeout);

        if (result.timedOut()) {
            throw new TransientInfraException(ErrorCode.OPERATION_TIMEOUT,
                    phase + " command exceeded " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() == 0) {
            return;
        }
        if (result.exitCode() == EX_TEMPFAIL) {
            throw new TransientInfraException(ErrorCode.PHASE_TEMPORARY_FAILURE,
                    phase + " reported a temporary failure: " + result.lastLine());
        }

        ErrorCode code = reportedCode(result.output()).orElse(ErrorCode.PHASE_FATAL);
        String message = phase + " failed (exit " + result.exitCode() + "): " + result.lastLine();
        if (code.category().isRecoverable()) {
            throw new TransientInfraException(code, message);
        }
        throw new FatalDeploymentException(code, message);
    }

    /** The last DIVE_ERROR line wins. */
    static Optional<ErrorCode> reportedCode(String output) {
        Matcher m = ERROR_LINE.matcher(output);
        ErrorCode found = null;
        while (m.find()) {
            found = ErrorCode.fromCode(Integer.parseInt(m.group(1)));
        }
        return Optional.ofNullable(found);
    }
}
