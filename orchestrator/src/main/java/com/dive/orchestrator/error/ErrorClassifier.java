package com.dive.orchestrator.error;

import com.dive.orchestrator.model.OrchestrationError;
import com.dive.orchestrator.repository.OrchestrationErrorRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Maps errors to a severity and a retry verdict, and keeps the error trail.
 *
 * <p>{@link #classify(int)} and {@link #classify(Throwable)} are pure and
 * total: every code resolves, unknown ones to {@link ErrorCode#UNKNOWN},
 * which is not recoverable. The pipeline decides retry versus rollback from
 * this verdict alone.
 *
 * <p>{@link #record} persists an {@link OrchestrationError} in its own
 * transaction so the trail survives even when the caller's work rolls back.
 */
@Service
public class ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    private static final int MAX_CAUSE_DEPTH = 16;

    private final OrchestrationErrorRepository errorRepo;
    private final ObjectMapper                 objectMapper;
    private final Clock                        clock;

    public ErrorClassifier(OrchestrationErrorRepository errorRepo,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.errorRepo    = errorRepo;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Classification
    // ------------------------------------------------------------------

    public ErrorClassification classify(int errorCode) {
        return ErrorClassification.of(ErrorCode.fromCode(errorCode));
    }

    public ErrorClassification classify(Throwable error) {
        return ErrorClassification.of(resolveCode(error));
    }

    /**
     * Walk the cause chain. The first engine exception wins; otherwise a few
     * well-known JDK network failures count as transient.
     */
    static ErrorCode resolveCode(Throwable error) {
        int depth = 0;
        for (Throwable t = error; t != null && depth < MAX_CAUSE_DEPTH; t = t.getCause(), depth++) {
            if (t instanceof OrchestrationException oe) {
                return oe.getErrorCode();
            }
            if (t instanceof ConnectException) {
                return ErrorCode.CONNECTION_REFUSED;
            }
            if (t instanceof HttpTimeoutException || t instanceof TimeoutException) {
                return ErrorCode.OPERATION_TIMEOUT;
            }
        }
        return ErrorCode.UNKNOWN;
    }

    // ------------------------------------------------------------------
    // Error trail
    // ------------------------------------------------------------------

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OrchestrationError record(String instanceCode, ErrorClassification classification,
                                     String source, String message, Map<String, ?> context) {
        return record(instanceCode, classification.code(), classification.severity(),
                source, message, context);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OrchestrationError record(String instanceCode, ErrorCode code, Severity severity,
                                     String source, String message, Map<String, ?> context) {
        OrchestrationError error = new OrchestrationError(
                instanceCode,
                code.code(),
                severity.level(),
                source,
                message,
                code.remediation(),
                toJson(context),
                clock.instant());
        log.warn("Recorded error {} ({}, severity {}) for {} from {}: {}",
                code.code(), code, severity.level(), instanceCode, source, message);
        return errorRepo.save(error);
    }

    @Transactional(readOnly = true)
    public List<OrchestrationError> recent(String instanceCode, int limit) {
        return errorRepo.findByInstanceCodeOrderByRecordedAtDescIdDesc(
                instanceCode, PageRequest.of(0, Math.max(1, limit)));
    }

    /** Number of recorded errors at least as severe as {@code minSeverity}. */
    @Transactional(readOnly = true)
    public long unresolved(String instanceCode, Severity minSeverity) {
        return errorRepo.countByInstanceCodeAndSeverityLessThanEqual(instanceCode, minSeverity.level());
    }

    private String toJson(Map<String, ?> context) {
        if (context == null || context.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Error context is not serializable: " + context.keySet(), e);
        }
    }
}
