package com.dive.orchestrator.error;

/**
 * A phase name outside the declared phase set.
 */
public class InvalidPhaseException extends ConfigurationException {

    private final String phaseName;

    public InvalidPhaseException(String phaseName) {
        super(ErrorCode.INVALID_PHASE, "Invalid phase: " + phaseName);
        this.phaseName = phaseName;
    }

    public String getPhaseName() { return phaseName; }
}
