package com.dive.orchestrator.error;

/**
 * Base of every failure the engine raises on purpose.
 *
 * Unchecked, like the rest of the service layer's exceptions. The carried
 * {@link ErrorCode} is what the {@link ErrorClassifier} looks at; the
 * subclass only tells callers which family the failure belongs to.
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorCode errorCode;

    public OrchestrationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OrchestrationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() { return errorCode; }
}
