package com.dive.orchestrator.model;

/**
 * Value of an instance's live state row.
 *
 * UNKNOWN is the sentinel for "never deployed". It is stored only as the
 * from_state of an instance's first transition and after an operator reset.
 * Phase names mirror {@link Phase}; FAILED and ROLLED_BACK are terminal.
 */
public enum DeploymentState {
    UNKNOWN,
    PREFLIGHT,
    INITIALIZATION,
    MONGODB_INIT,
    SERVICES,
    ORCHESTRATION_DB,
    KEYCLOAK_CONFIG,
    REALM_VERIFY,
    KAS_REGISTER,
    SEEDING,
    KAS_INIT,
    COMPLETE,
    FAILED,
    ROLLED_BACK;

    public static DeploymentState of(Phase phase) {
        return valueOf(phase.name());
    }

    /** COMPLETE, FAILED and ROLLED_BACK absorb further pipeline runs. */
    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == ROLLED_BACK;
    }

    /** Terminal failure states; a new run needs an explicit reset. */
    public boolean requiresReset() {
        return this == FAILED || this == ROLLED_BACK;
    }
}
