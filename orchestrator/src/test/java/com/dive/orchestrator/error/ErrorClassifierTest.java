package com.dive.orchestrator.error;

import com.dive.orchestrator.model.OrchestrationError;
import com.dive.orchestrator.repository.OrchestrationErrorRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ErrorClassifierTest {

    static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock OrchestrationErrorRepository errorRepo;

    ErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ErrorClassifier(errorRepo, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ------------------------------------------------------------------
    // classify(int)
    // ------------------------------------------------------------------

    @Test
    void classify_transientCode_isRecoverable() {
        ErrorClassification c = classifier.classify(1404);

        assertThat(c.code()).isEqualTo(ErrorCode.CONNECTION_REFUSED);
        assertThat(c.category()).isEqualTo(ErrorCategory.TRANSIENT);
        assertThat(c.recoverable()).isTrue();
        assertThat(c.remediation()).isNotBlank();
    }

    @Test
    void classify_permanentCode_isFatal() {
        ErrorClassification c = classifier.classify(1104);

        assertThat(c.category()).isEqualTo(ErrorCategory.PERMANENT);
        assertThat(c.recoverable()).isFalse();
    }

    @Test
    void classify_unknownCode_fallsBackToUnknownAndIsFatal() {
        ErrorClassification c = classifier.classify(4242);

        assertThat(c.code()).isEqualTo(ErrorCode.UNKNOWN);
        assertThat(c.category()).isEqualTo(ErrorCategory.UNKNOWN);
        assertThat(c.recoverable()).isFalse();
        assertThat(c.severity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void everyCode_hasRemediation() {
        for (ErrorCode code : ErrorCode.values()) {
            assertThat(code.remediation()).as(code.name()).isNotBlank();
            assertThat(ErrorCode.fromCode(code.code())).isEqualTo(code);
        }
    }

    // ------------------------------------------------------------------
    // classify(Throwable)
    // ------------------------------------------------------------------

    @Test
    void classify_engineException_usesItsCode() {
        ErrorClassification c = classifier.classify(new LockContentionException("fra"));

        assertThat(c.code()).isEqualTo(ErrorCode.LOCK_CONTENTION);
        assertThat(c.recoverable()).isTrue();
    }

    @Test
    void classify_wrappedConnectException_isConnectionRefused() {
        RuntimeException wrapped = new UncheckedIOException(new ConnectException("Connection refused"));

        assertThat(classifier.classify(wrapped).code()).isEqualTo(ErrorCode.CONNECTION_REFUSED);
    }

    @Test
    void classify_httpTimeout_isOperationTimeout() {
        RuntimeException wrapped = new RuntimeException(new HttpTimeoutException("timed out"));

        assertThat(classifier.classify(wrapped).code()).isEqualTo(ErrorCode.OPERATION_TIMEOUT);
    }

    @Test
    void classify_plainRuntimeException_isUnknown() {
        assertThat(classifier.classify(new IllegalStateException("?")).code()).isEqualTo(ErrorCode.UNKNOWN);
        assertThat(classifier.classify(new UncheckedIOException(new IOException("disk"))).code())
                .isEqualTo(ErrorCode.UNKNOWN);
    }

    @Test
    void classify_outermostEngineExceptionWins() {
        FatalDeploymentException outer = new FatalDeploymentException(ErrorCode.TERRAFORM_APPLY_FAILED,
                "apply failed", new TransientInfraException(ErrorCode.CONNECTION_REFUSED, "refused"));

        assertThat(classifier.classify(outer).code()).isEqualTo(ErrorCode.TERRAFORM_APPLY_FAILED);
    }

    // ------------------------------------------------------------------
    // record()
    // ------------------------------------------------------------------

    @Test
    void record_persistsCodeSeverityRemediationAndContextJson() {
        when(errorRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        classifier.record("fra", classifier.classify(1702), "phase:REALM_VERIFY", "circuit open",
                Map.of("attempt", 2));

        ArgumentCaptor<OrchestrationError> saved = ArgumentCaptor.forClass(OrchestrationError.class);
        verify(errorRepo).save(saved.capture());
        OrchestrationError e = saved.getValue();
        assertThat(e.getErrorCode()).isEqualTo(1702);
        assertThat(e.getSeverity()).isEqualTo(Severity.MEDIUM.level());
        assertThat(e.getSource()).isEqualTo("phase:REALM_VERIFY");
        assertThat(e.getRemediation()).isEqualTo(ErrorCode.CIRCUIT_OPEN.remediation());
        assertThat(e.getContext()).isEqualTo("{\"attempt\":2}");
        assertThat(e.getRecordedAt()).isEqualTo(NOW);
    }

    @Test
    void record_emptyContext_storesNull() {
        when(errorRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        OrchestrationError e = classifier.record("fra", ErrorCode.UNKNOWN, Severity.LOW, "test", "msg", Map.of());

        assertThat(e.getContext()).isNull();
        assertThat(e.getSeverity()).isEqualTo(Severity.LOW.level());
    }
}
