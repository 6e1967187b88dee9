package com.dive.orchestrator.error;

/**
 * Verdict of the {@link ErrorClassifier} for a single error.
 */
public record ErrorClassification(
        ErrorCode     code,
        ErrorCategory category,
        Severity      severity,
        boolean       recoverable,
        String        remediation
) {
    public static ErrorClassification of(ErrorCode code) {
        return new ErrorClassification(code, code.category(), code.severity(),
                code.category().isRecoverable(), code.remediation());
    }
}
