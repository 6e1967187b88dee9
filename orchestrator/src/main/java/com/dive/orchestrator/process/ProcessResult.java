package com.dive.orchestrator.process;

import java.util.List;

/**
 * Exit status and combined output of an external command.
 */
public record ProcessResult(List<String> command, int exitCode, String output, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /** Last non-blank output line, for error messages. */
    public String lastLine() {
        String[] lines = output.strip().split("\\R");
        return lines.length == 0 ? "" : lines[lines.length - 1];
    }
}
