package com.dive.orchestrator.model;

import com.dive.orchestrator.error.InvalidPhaseException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed, ordered set of deployment phases.
 *
 * Declaration order is the execution order and defines "next phase" and
 * the resume point. Every phase names the external dependency its circuit
 * breaker protects and the rollback strategy used when it fails fatally.
 */
public enum Phase {

    PREFLIGHT        ("docker-engine",      RollbackStrategy.CONFIG),
    INITIALIZATION   ("secret-store",       RollbackStrategy.CONFIG),
    MONGODB_INIT     ("mongodb",            RollbackStrategy.COMPLETE),
    SERVICES         ("docker-compose",     RollbackStrategy.COMPLETE),
    ORCHESTRATION_DB ("postgres",           RollbackStrategy.CONFIG),
    KEYCLOAK_CONFIG  ("terraform-apply",    RollbackStrategy.CONFIG),
    REALM_VERIFY     ("keycloak-token",     RollbackStrategy.CONFIG),
    KAS_REGISTER     ("hub-federation-api", RollbackStrategy.CONFIG),
    SEEDING          ("keycloak-admin",     RollbackStrategy.CONFIG),
    KAS_INIT         ("kas",                RollbackStrategy.CONFIG),
    COMPLETE         (null,                 RollbackStrategy.STOP);

    private final String breakerKey;
    private final RollbackStrategy rollbackStrategy;

    Phase(String breakerKey, RollbackStrategy rollbackStrategy) {
        this.breakerKey       = breakerKey;
        this.rollbackStrategy = rollbackStrategy;
    }

    /** Circuit breaker operation guarding this phase; empty for COMPLETE. */
    public Optional<String> breakerKey()       { return Optional.ofNullable(breakerKey); }
    public RollbackStrategy rollbackStrategy() { return rollbackStrategy; }

    public Optional<Phase> next() {
        int idx = ordinal() + 1;
        return idx < values().length ? Optional.of(values()[idx]) : Optional.empty();
    }

    /**
     * The single validation boundary for phase names coming from outside
     * (REST, CLI, persisted rows). Case-insensitive.
     *
     * @throws InvalidPhaseException for anything outside the closed set
     */
    public static Phase parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidPhaseException(String.valueOf(name));
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidPhaseException(name));
    }
}
