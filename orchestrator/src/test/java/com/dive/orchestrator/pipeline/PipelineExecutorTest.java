package com.dive.orchestrator.pipeline;

import com.dive.orchestrator.breaker.CircuitBreakerRegistry;
import com.dive.orchestrator.breaker.CircuitBreakerStore;
import com.dive.orchestrator.config.OrchestratorProperties;
import com.dive.orchestrator.error.CircuitOpenException;
import com.dive.orchestrator.error.ErrorClassifier;
import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.error.FatalDeploymentException;
import com.dive.orchestrator.error.LockContentionException;
import com.dive.orchestrator.error.RollbackFailedException;
import com.dive.orchestrator.error.TransientInfraException;
import com.dive.orchestrator.federation.FederationClient;
import com.dive.orchestrator.federation.FederationException;
import com.dive.orchestrator.model.DeploymentState;
import com.dive.orchestrator.model.DeploymentStep;
import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.model.PipelineMode;
import com.dive.orchestrator.model.RollbackStrategy;
import com.dive.orchestrator.model.StepStatus;
import com.dive.orchestrator.phase.PhaseHandler;
import com.dive.orchestrator.phase.PhaseRegistry;
import com.dive.orchestrator.process.ProcessRunner;
import com.dive.orchestrator.repository.DeploymentStepRepository;
import com.dive.orchestrator.repository.MetricRepository;
import com.dive.orchestrator.repository.OrchestrationErrorRepository;
import com.dive.orchestrator.service.AdvisoryLockManager;
import com.dive.orchestrator.service.CheckpointStore;
import com.dive.orchestrator.service.StateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Pipeline control-flow tests.
 *
 * Persistence collaborators are mocks backed by in-memory state; the
 * breaker registry, error classifier and phase registry are real so retry,
 * short-circuit and classification decisions run end to end.
 */
@ExtendWith(MockitoExtension.class)
class PipelineExecutorTest {

    static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    static final List<Phase> WORK_PHASES = Arrays.stream(Phase.values())
            .filter(p -> p != Phase.COMPLETE)
            .toList();

    @Mock StateStore                   stateStore;
    @Mock AdvisoryLockManager          lockManager;
    @Mock CheckpointStore              checkpointStore;
    @Mock CircuitBreakerStore          breakerStore;
    @Mock OrchestrationErrorRepository errorRepo;
    @Mock RollbackService              rollbackService;
    @Mock DeploymentStepRepository     stepRepo;
    @Mock MetricRepository             metricRepo;
    @Mock FederationClient             federation;

    final List<String>                       calls     = Collections.synchronizedList(new ArrayList<>());
    final Set<String>                        completed = ConcurrentHashMap.newKeySet();
    final List<Phase>                        skipped   = Collections.synchronizedList(new ArrayList<>());
    final Map<Phase, RuntimeException>       always    = new EnumMap<>(Phase.class);
    final Map<Phase, Deque<RuntimeException>> scripted = new EnumMap<>(Phase.class);
    volatile long phaseSleepMillis = 0;

    SimpleMeterRegistry meters;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();

        lenient().when(stateStore.getState(anyString())).thenReturn(DeploymentState.UNKNOWN);
        lenient().when(lockManager.acquire(anyString(), anyString(), any())).thenReturn(true);
        lenient().when(lockManager.renew(anyString(), anyString())).thenReturn(true);
        lenient().when(stepRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(rollbackService.rollback(anyString(), any(), any()))
                .thenAnswer(inv -> new RollbackOutcome(inv.getArgument(1), null));

        lenient().when(checkpointStore.isComplete(anyString(), any(Phase.class)))
                .thenAnswer(inv -> completed.contains(key(inv.getArgument(0), inv.getArgument(1))));
        lenient().when(checkpointStore.markComplete(anyString(), any(Phase.class), any(), any()))
                .thenAnswer(inv -> {
                    Phase phase = inv.getArgument(1);
                    Map<String, ?> data = inv.getArgument(3);
                    if (data != null && data.containsKey("skipped")) skipped.add(phase);
                    completed.add(key(inv.getArgument(0), phase));
                    return null;
                });
        lenient().when(checkpointStore.canResume(anyString())).thenAnswer(inv -> {
            String code = inv.getArgument(0);
            return completed.stream().anyMatch(k -> k.startsWith(code + ":"))
                    && !completed.contains(key(code, Phase.COMPLETE));
        });
    }

    // ------------------------------------------------------------------
    // Happy path / resume
    // ------------------------------------------------------------------

    @Test
    void run_freshInstance_runsEveryPhaseInOrderAndCompletes() {
        PipelineResult result = executor(5).run("FRA", PipelineMode.DEPLOY);

        assertThat(result.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(calls).containsExactlyElementsOf(
                WORK_PHASES.stream().map(p -> "fra:" + p).toList());
        verify(stateStore).setState(eq("fra"), eq(DeploymentState.COMPLETE), anyString(), any());
        verify(checkpointStore).markComplete(eq("fra"), eq(Phase.COMPLETE), any(), any());
        verify(rollbackService, never()).rollback(any(), any(), any());
        verify(lockManager).release(eq("fra"), anyString());
        assertThat(meters.counter("dive.pipeline.runs", "outcome", "completed").count()).isEqualTo(1.0);
        assertThat(MDC.get("instance")).isNull();
    }

    @Test
    void run_eachPhaseRecordsStepCheckpointAndState() {
        executor(5).run("fra", PipelineMode.DEPLOY);

        verify(stateStore).setState(eq("fra"), eq(DeploymentState.KEYCLOAK_CONFIG), anyString(), any());
        ArgumentCaptor<DeploymentStep> steps = ArgumentCaptor.forClass(DeploymentStep.class);
        verify(stepRepo, atLeast(WORK_PHASES.size())).save(steps.capture());
        assertThat(steps.getAllValues())
                .filteredOn(s -> s.getPhase() == Phase.SERVICES)
                .allSatisfy(s -> assertThat(s.getStatus()).isEqualTo(StepStatus.COMPLETED));
        verify(metricRepo, times(WORK_PHASES.size())).save(any());
        verify(breakerStore).recordSuccess("terraform-apply");
    }

    @Test
    void run_withCheckpoints_resumesAtFirstIncompletePhase() {
        completed.add(key("fra", Phase.PREFLIGHT));
        completed.add(key("fra", Phase.INITIALIZATION));
        completed.add(key("fra", Phase.MONGODB_INIT));

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(result.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(calls).first().isEqualTo("fra:SERVICES");
        assertThat(calls).doesNotContain("fra:PREFLIGHT", "fra:INITIALIZATION", "fra:MONGODB_INIT");
    }

    @Test
    void run_upMode_skipsInitializationAndSeeding() {
        PipelineResult result = executor(5).run("fra", PipelineMode.UP);

        assertThat(result.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(calls).doesNotContain("fra:INITIALIZATION", "fra:SEEDING");
        assertThat(skipped).containsExactly(Phase.INITIALIZATION, Phase.SEEDING);
    }

    @Test
    void run_complete_isNoOp() {
        when(stateStore.getState("usa")).thenReturn(DeploymentState.COMPLETE);

        PipelineResult result = executor(5).run("usa", PipelineMode.DEPLOY);

        assertThat(result.status()).isEqualTo(PipelineStatus.ALREADY_COMPLETE);
        assertThat(result.status().isSuccess()).isTrue();
        assertThat(calls).isEmpty();
        verify(stateStore, never()).setState(any(), any(), any(), any());
    }

    @Test
    void run_failedInstance_requiresReset() {
        when(stateStore.getState("fra")).thenReturn(DeploymentState.FAILED);

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(result.status()).isEqualTo(PipelineStatus.REQUIRES_RESET);
        assertThat(calls).isEmpty();
    }

    @Test
    void run_federationReconcileFails_stillCompletes() {
        when(federation.reconcilesOnComplete()).thenReturn(true);
        when(federation.reconcile("fra")).thenThrow(new FederationException("drift API down"));

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(result.status()).isEqualTo(PipelineStatus.COMPLETED);
        verify(errorRepo).save(argThat(e -> e.getErrorCode() == ErrorCode.FEDERATION_SYNC_FAILED.code()));
    }

    // ------------------------------------------------------------------
    // Retry and rollback
    // ------------------------------------------------------------------

    @Test
    void run_transientFailureEveryAttempt_retriesThreeTimesThenRollsBackOnce() {
        always.put(Phase.KEYCLOAK_CONFIG,
                new TransientInfraException(ErrorCode.CONNECTION_REFUSED, "terraform: connection refused"));

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(calls).filteredOn("fra:KEYCLOAK_CONFIG"::equals).hasSize(3);
        assertThat(calls).doesNotContain("fra:REALM_VERIFY");
        verify(rollbackService, times(1)).rollback(eq("fra"), eq(RollbackStrategy.CONFIG), anyString());
        verify(stateStore).setState(eq("fra"), eq(DeploymentState.FAILED), anyString(),
                argThat(m -> m != null && "KEYCLOAK_CONFIG".equals(m.get("failed_phase"))));
        assertThat(result.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(result.failedPhase()).isEqualTo(Phase.KEYCLOAK_CONFIG);
        assertThat(result.errorCode()).isEqualTo(1404);
        assertThat(result.remediation()).isNotBlank();
        assertThat(result.resumable()).isTrue();
        verify(breakerStore, times(3)).recordFailure("terraform-apply");
    }

    @Test
    void run_transientThenSuccess_continues() {
        scripted.put(Phase.SERVICES, new ArrayDeque<>(List.of(
                new TransientInfraException(ErrorCode.HEALTH_CHECK_TIMEOUT, "keycloak not healthy"))));

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(result.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(calls).filteredOn("fra:SERVICES"::equals).hasSize(2);
        verify(stepRepo, atLeastOnce()).save(argThat(s -> s.getPhase() == Phase.SERVICES
                && s.getAttempt() == 1 && s.getStatus() == StepStatus.FAILED
                && Integer.valueOf(1401).equals(s.getErrorCode())));
    }

    @Test
    void run_fatalFailure_rollsBackWithoutRetry() {
        always.put(Phase.KEYCLOAK_CONFIG,
                new FatalDeploymentException(ErrorCode.TERRAFORM_APPLY_FAILED, "invalid realm"));
        when(rollbackService.rollback(eq("fra"), eq(RollbackStrategy.CONFIG), anyString()))
                .thenReturn(new RollbackOutcome(RollbackStrategy.CONFIG, Phase.ORCHESTRATION_DB));

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(calls).filteredOn("fra:KEYCLOAK_CONFIG"::equals).hasSize(1);
        assertThat(result.status()).isEqualTo(PipelineStatus.ROLLED_BACK);
        assertThat(result.errorCode()).isEqualTo(1104);
        verify(stateStore).setState(eq("fra"), eq(DeploymentState.ROLLED_BACK), anyString(),
                argThat(m -> m != null && "ORCHESTRATION_DB".equals(m.get("restored_phase"))));
    }

    @Test
    void run_unclassifiedException_isFatal() {
        always.put(Phase.PREFLIGHT, new IllegalStateException("boom"));

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(calls).containsExactly("fra:PREFLIGHT");
        assertThat(result.errorCode()).isEqualTo(ErrorCode.UNKNOWN.code());
        assertThat(result.resumable()).isFalse();
    }

    @Test
    void run_openCircuit_shortCircuitsPhaseAndRollsBack() {
        doThrow(new CircuitOpenException("keycloak-token", NOW.plusSeconds(60)))
                .when(breakerStore).acquirePermission("keycloak-token");

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(calls).contains("fra:KEYCLOAK_CONFIG").doesNotContain("fra:REALM_VERIFY");
        verify(breakerStore, times(1)).acquirePermission("keycloak-token");
        verify(rollbackService).rollback(eq("fra"), eq(RollbackStrategy.CONFIG), anyString());
        assertThat(result.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(result.failedPhase()).isEqualTo(Phase.REALM_VERIFY);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.CIRCUIT_OPEN.code());
    }

    @Test
    void run_rollbackItselfFails_reportsRollbackFailed() {
        always.put(Phase.SERVICES, new FatalDeploymentException(ErrorCode.PHASE_FATAL, "compose broke"));
        when(rollbackService.rollback(eq("fra"), eq(RollbackStrategy.COMPLETE), anyString()))
                .thenThrow(new RollbackFailedException("restore failed", new RuntimeException("disk full")));

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(result.status()).isEqualTo(PipelineStatus.ROLLBACK_FAILED);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.ROLLBACK_FAILED.code());
        assertThat(result.resumable()).isFalse();
        verify(stateStore).setState(eq("fra"), eq(DeploymentState.FAILED), anyString(),
                argThat(m -> m != null && Boolean.TRUE.equals(m.get("rollback_failed"))));
    }

    @Test
    void run_tooManyFailuresAcrossPhases_abortsRun() {
        TransientInfraException flaky = new TransientInfraException(ErrorCode.OPERATION_TIMEOUT, "slow");
        scripted.put(Phase.PREFLIGHT, new ArrayDeque<>(List.of(flaky, flaky)));
        scripted.put(Phase.INITIALIZATION, new ArrayDeque<>(List.of(flaky, flaky)));

        PipelineResult result = executor(3).run("fra", PipelineMode.DEPLOY);

        assertThat(result.status()).isEqualTo(PipelineStatus.ABORTED_THRESHOLD);
        assertThat(result.failedPhase()).isEqualTo(Phase.INITIALIZATION);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.FAILURE_THRESHOLD_EXCEEDED.code());
        verify(errorRepo).save(argThat(e -> e.getErrorCode() == ErrorCode.FAILURE_THRESHOLD_EXCEEDED.code()));
        verify(rollbackService).rollback(eq("fra"), eq(RollbackStrategy.CONFIG), anyString());
    }

    @Test
    void run_missingHandler_isFatalWithoutBreakerFailure() {
        PipelineExecutor executor = executor(5, WORK_PHASES.stream()
                .filter(p -> p != Phase.KAS_INIT).toList());

        PipelineResult result = executor.run("fra", PipelineMode.DEPLOY);

        assertThat(result.errorCode()).isEqualTo(ErrorCode.PHASE_NOT_CONFIGURED.code());
        assertThat(result.failedPhase()).isEqualTo(Phase.KAS_INIT);
        verify(breakerStore, never()).recordFailure(any());
    }

    // ------------------------------------------------------------------
    // Locking and concurrency
    // ------------------------------------------------------------------

    @Test
    void run_lockHeldElsewhere_returnsContentionWithoutSideEffects() {
        when(lockManager.acquire(eq("fra"), anyString(), any())).thenReturn(false);

        PipelineResult result = executor(5).run("fra", PipelineMode.DEPLOY);

        assertThat(result.status()).isEqualTo(PipelineStatus.LOCK_CONTENTION);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.LOCK_CONTENTION.code());
        assertThat(calls).isEmpty();
        verify(lockManager, never()).release(any(), any());
        verify(rollbackService, never()).rollback(any(), any(), any());
        verify(stateStore, never()).setState(any(), any(), any(), any());
    }

    @Test
    void run_twoInstancesConcurrently_doNotSerialize() throws Exception {
        phaseSleepMillis = 100;
        PipelineExecutor executor = executor(5);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            long start = System.nanoTime();
            Future<PipelineResult> fra = pool.submit(() -> executor.run("fra", PipelineMode.DEPLOY));
            Future<PipelineResult> deu = pool.submit(() -> executor.run("deu", PipelineMode.DEPLOY));

            assertThat(fra.get().status()).isEqualTo(PipelineStatus.COMPLETED);
            assertThat(deu.get().status()).isEqualTo(PipelineStatus.COMPLETED);
            // ten phases at 100 ms each: about 1 s per run, 2 s if serialized
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(1800));
        } finally {
            pool.shutdownNow();
        }
        assertThat(calls).filteredOn(c -> c.startsWith("fra:")).hasSize(WORK_PHASES.size());
        assertThat(calls).filteredOn(c -> c.startsWith("deu:")).hasSize(WORK_PHASES.size());
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    @Test
    void reset_clearsCheckpointsAndStateUnderLock() {
        when(checkpointStore.clearAll("fra", "confirm")).thenReturn(4L);

        long cleared = executor(5).reset("FRA", "confirm");

        assertThat(cleared).isEqualTo(4);
        verify(stateStore).reset(eq("fra"), anyString());
        verify(lockManager).release(eq("fra"), anyString());
    }

    @Test
    void reset_whileLocked_throwsContention() {
        when(lockManager.acquire(eq("fra"), anyString(), eq(Duration.ZERO))).thenReturn(false);

        assertThatThrownBy(() -> executor(5).reset("fra", "confirm"))
                .isInstanceOf(LockContentionException.class);
        verify(checkpointStore, never()).clearAll(any(), any());
    }

    @Test
    void reset_wrongToken_releasesLock() {
        when(checkpointStore.clearAll("fra", "nope")).thenThrow(new IllegalArgumentException("token"));

        assertThatThrownBy(() -> executor(5).reset("fra", "nope"))
                .isInstanceOf(IllegalArgumentException.class);
        verify(lockManager).release(eq("fra"), anyString());
        verify(stateStore, never()).reset(any(), any());
    }

    @Test
    void forceRollback_restoresLatestCheckpoint() {
        when(stateStore.getState("fra")).thenReturn(DeploymentState.SERVICES);
        when(rollbackService.rollback(eq("fra"), eq(RollbackStrategy.COMPLETE), anyString()))
                .thenReturn(new RollbackOutcome(RollbackStrategy.COMPLETE, Phase.MONGODB_INIT));

        PipelineResult result = executor(5).forceRollback("fra");

        assertThat(result.status()).isEqualTo(PipelineStatus.ROLLED_BACK);
        verify(stateStore).setState(eq("fra"), eq(DeploymentState.ROLLED_BACK), anyString(), any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineExecutor executor(int failureThreshold) {
        return executor(failureThreshold, WORK_PHASES);
    }

    private PipelineExecutor executor(int failureThreshold, List<Phase> handled) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        List<PhaseHandler> handlers = handled.stream().map(p -> (PhaseHandler) new ScriptedHandler(p)).toList();
        PhaseRegistry registry = new PhaseRegistry(handlers, new OrchestratorProperties(List.of(), Map.of()),
                mock(ProcessRunner.class), Path.of("."), Duration.ofMinutes(1));
        return new PipelineExecutor(
                stateStore,
                lockManager,
                checkpointStore,
                new CircuitBreakerRegistry(breakerStore, meters),
                new ErrorClassifier(errorRepo, new ObjectMapper(), clock),
                registry,
                rollbackService,
                stepRepo,
                metricRepo,
                federation,
                meters,
                new RetryPolicy(3, Duration.ofMillis(1), 2.0, Duration.ofMillis(5)),
                clock,
                Duration.ZERO,
                failureThreshold);
    }

    private static String key(String code, Phase phase) {
        return code + ":" + phase;
    }

    private final class ScriptedHandler implements PhaseHandler {
        private final Phase phase;

        ScriptedHandler(Phase phase) { this.phase = phase; }

        @Override
        public Phase phase() { return phase; }

        @Override
        public void execute(String instanceCode, PipelineMode mode) {
            calls.add(instanceCode + ":" + phase);
            if (phaseSleepMillis > 0) {
                try {
                    Thread.sleep(phaseSleepMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            RuntimeException failure = always.get(phase);
            if (failure != null) throw failure;
            Deque<RuntimeException> queue = scripted.get(phase);
            synchronized (scripted) {
                if (queue != null && !queue.isEmpty()) throw queue.poll();
            }
        }
    }
}
