package com.dive.orchestrator.error;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed table of every error code the engine can raise or receive from a
 * phase, with its retry category, default severity and remediation hint.
 *
 * Families:
 *   10xx preflight and prerequisites
 *   11xx initialization and configuration
 *   12xx containers and services
 *   13xx federation
 *   14xx health checks and timeouts
 *   15xx orchestration database and state
 *   16xx engine configuration
 *   17xx engine control flow
 *   19xx unknown
 */
public enum ErrorCode {

    // 10xx preflight
    PREREQUISITE_MISSING      (1001, ErrorCategory.PERMANENT,   Severity.CRITICAL,
            "Install the missing prerequisite (docker, docker compose v2, jq) and re-run the deployment."),
    HUB_UNHEALTHY             (1002, ErrorCategory.TRANSIENT,   Severity.HIGH,
            "Check the hub deployment health; the spoke retries once the hub answers."),
    NETWORK_SETUP_FAILED      (1003, ErrorCategory.RECOVERABLE, Severity.HIGH,
            "Inspect 'docker network ls' for a conflicting shared network and remove it."),
    SECRET_LOAD_FAILED        (1004, ErrorCategory.RECOVERABLE, Severity.HIGH,
            "Verify secret-manager credentials and that the instance's secrets exist."),
    INSTANCE_CONFIG_INVALID   (1006, ErrorCategory.PERMANENT,   Severity.CRITICAL,
            "Fix the instance configuration file; the deployment cannot proceed with it."),

    // 11xx initialization
    CERTIFICATE_FAILED        (1101, ErrorCategory.RECOVERABLE, Severity.HIGH,
            "Regenerate the instance certificates and check mkcert / CA availability."),
    TERRAFORM_INVALID         (1103, ErrorCategory.PERMANENT,   Severity.CRITICAL,
            "Run 'terraform validate' in the instance workspace and fix the reported errors."),
    TERRAFORM_APPLY_FAILED    (1104, ErrorCategory.PERMANENT,   Severity.HIGH,
            "Inspect the Terraform plan output; resolve state drift before retrying."),
    KEYCLOAK_CONFIG_FAILED    (1106, ErrorCategory.RECOVERABLE, Severity.HIGH,
            "Check the Keycloak admin credentials and that the realm import completed."),

    // 12xx containers
    CONTAINER_START_FAILED    (1201, ErrorCategory.RECOVERABLE, Severity.HIGH,
            "Inspect 'docker compose logs' for the failing service."),
    CONTAINER_UNHEALTHY       (1202, ErrorCategory.RECOVERABLE, Severity.MEDIUM,
            "Wait for the container health check or inspect its logs."),
    IMAGE_PULL_FAILED         (1204, ErrorCategory.TRANSIENT,   Severity.MEDIUM,
            "Check registry connectivity and credentials."),
    STALE_CONTAINER_CLEANUP   (1207, ErrorCategory.RECOVERABLE, Severity.MEDIUM,
            "Remove leftover containers of the instance with 'docker compose down'."),

    // 13xx federation
    FEDERATION_SETUP_FAILED   (1301, ErrorCategory.RECOVERABLE, Severity.HIGH,
            "Verify that the hub identity broker is reachable from the spoke."),
    FEDERATION_REGISTER_FAILED(1302, ErrorCategory.RECOVERABLE, Severity.HIGH,
            "Re-run spoke registration against the hub federation API."),
    FEDERATION_VERIFY_FAILED  (1303, ErrorCategory.RECOVERABLE, Severity.MEDIUM,
            "Check identity-provider links on both hub and spoke realms."),
    OPAL_TOKEN_FAILED         (1308, ErrorCategory.RECOVERABLE, Severity.MEDIUM,
            "Re-provision the policy-sync client token from the hub."),
    FEDERATION_SYNC_FAILED    (1310, ErrorCategory.RECOVERABLE, Severity.LOW,
            "Trigger a reconcile against the federation drift API once it is reachable."),

    // 14xx health / timeouts
    HEALTH_CHECK_TIMEOUT      (1401, ErrorCategory.RECOVERABLE, Severity.MEDIUM,
            "The service did not become healthy in time; check its logs and resource limits."),
    DEPENDENCY_TIMEOUT        (1402, ErrorCategory.RECOVERABLE, Severity.MEDIUM,
            "A dependency of the service did not become healthy; start it individually."),
    OPERATION_TIMEOUT         (1403, ErrorCategory.TRANSIENT,   Severity.MEDIUM,
            "The remote call timed out; it is retried with backoff."),
    CONNECTION_REFUSED        (1404, ErrorCategory.TRANSIENT,   Severity.MEDIUM,
            "The remote endpoint refused the connection; check that it is running."),

    // 15xx state
    STATE_DB_UNAVAILABLE      (1501, ErrorCategory.RECOVERABLE, Severity.HIGH,
            "Check that the orchestration database is running and reachable."),
    STATE_DB_BUSY             (1502, ErrorCategory.TRANSIENT,   Severity.MEDIUM,
            "The orchestration database is busy; the operation is retried."),
    INVALID_STATE_TRANSITION  (1505, ErrorCategory.RECOVERABLE, Severity.MEDIUM,
            "Inspect the transition history and reset the instance if it is inconsistent."),

    // 16xx engine configuration
    DEPENDENCY_CYCLE          (1601, ErrorCategory.PERMANENT,   Severity.CRITICAL,
            "Remove the cycle from the service depends-on configuration."),
    INVALID_PHASE             (1602, ErrorCategory.PERMANENT,   Severity.HIGH,
            "Use one of the declared phase names."),
    INVALID_CHECKPOINT        (1603, ErrorCategory.PERMANENT,   Severity.HIGH,
            "Validate the instance's checkpoints and clear the inconsistent ones."),
    PHASE_NOT_CONFIGURED      (1604, ErrorCategory.PERMANENT,   Severity.CRITICAL,
            "Register a handler or configure a command for the phase."),

    // 17xx control flow
    LOCK_CONTENTION           (1701, ErrorCategory.TRANSIENT,   Severity.MEDIUM,
            "Another pipeline holds the instance lock; wait for it or release a stale lock."),
    CIRCUIT_OPEN              (1702, ErrorCategory.TRANSIENT,   Severity.MEDIUM,
            "The downstream dependency is failing repeatedly; wait for the breaker cool-down or reset it."),
    PHASE_FATAL               (1703, ErrorCategory.PERMANENT,   Severity.CRITICAL,
            "The phase reported an unrecoverable failure; inspect its output before re-running."),
    ROLLBACK_FAILED           (1704, ErrorCategory.PERMANENT,   Severity.CRITICAL,
            "Checkpoint restore failed; restore the instance configuration manually."),
    FAILURE_THRESHOLD_EXCEEDED(1705, ErrorCategory.PERMANENT,   Severity.HIGH,
            "Too many failures in one run; fix the underlying issues before re-running."),
    PHASE_TEMPORARY_FAILURE   (1706, ErrorCategory.TRANSIENT,   Severity.MEDIUM,
            "The phase reported a temporary failure; it is retried with backoff."),
    STATE_ROLLBACK            (1707, ErrorCategory.RECOVERABLE, Severity.HIGH,
            "State was rolled back to the previous transition."),

    UNKNOWN                   (1999, ErrorCategory.UNKNOWN,     Severity.HIGH,
            "Unclassified failure; inspect the error context and logs.");

    private static final Map<Integer, ErrorCode> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ErrorCode::code, Function.identity()));

    private final int           code;
    private final ErrorCategory category;
    private final Severity      severity;
    private final String        remediation;

    ErrorCode(int code, ErrorCategory category, Severity severity, String remediation) {
        this.code        = code;
        this.category    = category;
        this.severity    = severity;
        this.remediation = remediation;
    }

    public int           code()        { return code; }
    public ErrorCategory category()    { return category; }
    public Severity      severity()    { return severity; }
    public String        remediation() { return remediation; }

    /** Total: codes missing from the table resolve to {@link #UNKNOWN}. */
    public static ErrorCode fromCode(int code) {
        return BY_CODE.getOrDefault(code, UNKNOWN);
    }
}
