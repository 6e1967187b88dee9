package com.dive.orchestrator.error;

/**
 * Static configuration is wrong (dependency cycle, unknown phase, missing
 * handler, broken checkpoint set). Always fatal, never retried.
 */
public class ConfigurationException extends OrchestrationException {

    public ConfigurationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
