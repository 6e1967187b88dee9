package com.dive.orchestrator.breaker;

import com.dive.orchestrator.error.CircuitOpenException;
import com.dive.orchestrator.error.InvalidPhaseException;
import com.dive.orchestrator.error.TransientInfraException;
import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.model.CircuitBreakerRecord;
import com.dive.orchestrator.model.CircuitState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CircuitBreakerRegistryTest {

    static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Mock CircuitBreakerStore store;

    SimpleMeterRegistry meters;
    CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        meters   = new SimpleMeterRegistry();
        registry = new CircuitBreakerRegistry(store, meters);
    }

    @Test
    void execute_success_recordsSuccessAndReturnsValue() {
        String result = registry.execute("kas", () -> "ok");

        assertThat(result).isEqualTo("ok");
        verify(store).acquirePermission("kas");
        verify(store).recordSuccess("kas");
        verify(store, never()).recordFailure(any());
        assertThat(meters.counter("dive.circuit.calls", "operation", "kas", "outcome", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void execute_failure_recordsFailureAndRethrows() {
        TransientInfraException boom = new TransientInfraException(ErrorCode.CONNECTION_REFUSED, "refused");

        assertThatThrownBy(() -> registry.execute("kas", () -> { throw boom; }))
                .isSameAs(boom);
        verify(store).recordFailure("kas");
        verify(store, never()).recordSuccess(any());
    }

    @Test
    void execute_open_shortCircuitsWithoutInvokingCall() {
        doThrow(new CircuitOpenException("kas", T0)).when(store).acquirePermission("kas");
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> registry.run("kas", calls::incrementAndGet))
                .isInstanceOf(CircuitOpenException.class);

        assertThat(calls).hasValue(0);
        verify(store, never()).recordFailure(any());
        assertThat(meters.counter("dive.circuit.rejections", "operation", "kas").count()).isEqualTo(1.0);
    }

    @Test
    void execute_configurationError_isNotCountedAgainstBreaker() {
        assertThatThrownBy(() -> registry.run("kas", () -> { throw new InvalidPhaseException("BOGUS"); }))
                .isInstanceOf(InvalidPhaseException.class);

        verify(store, never()).recordFailure(any());
        verify(store, never()).recordSuccess(any());
        verify(store).releaseTrial("kas");
    }

    @Test
    void getState_unseenOperation_isClosed() {
        when(store.find("new-op")).thenReturn(Optional.empty());

        assertThat(registry.getState("new-op")).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void resetAllOpen_resetsOnlyNonClosedBreakers() {
        CircuitBreakerRecord closed = new CircuitBreakerRecord("a", T0);
        CircuitBreakerRecord open = new CircuitBreakerRecord("b", T0);
        open.setState(CircuitState.OPEN);
        CircuitBreakerRecord halfOpen = new CircuitBreakerRecord("c", T0);
        halfOpen.setState(CircuitState.HALF_OPEN);
        when(store.findAll()).thenReturn(List.of(closed, open, halfOpen));

        List<String> reset = registry.resetAllOpen();

        assertThat(reset).containsExactly("b", "c");
        verify(store).reset("b");
        verify(store).reset("c");
        verify(store, never()).reset("a");
    }
}
