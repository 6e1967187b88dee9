package com.dive.orchestrator.pipeline;

import com.dive.orchestrator.breaker.CircuitBreakerRegistry;
import com.dive.orchestrator.error.CircuitOpenException;
import com.dive.orchestrator.error.ErrorClassification;
import com.dive.orchestrator.error.ErrorClassifier;
import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.error.LockContentionException;
import com.dive.orchestrator.error.RollbackFailedException;
import com.dive.orchestrator.federation.FederationClient;
import com.dive.orchestrator.federation.FederationException;
import com.dive.orchestrator.model.DeploymentState;
import com.dive.orchestrator.model.DeploymentStep;
import com.dive.orchestrator.model.OrchestrationMetric;
import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.model.PipelineMode;
import com.dive.orchestrator.model.RollbackStrategy;
import com.dive.orchestrator.model.StepStatus;
import com.dive.orchestrator.phase.PhaseHandler;
import com.dive.orchestrator.phase.PhaseRegistry;
import com.dive.orchestrator.repository.DeploymentStepRepository;
import com.dive.orchestrator.repository.MetricRepository;
import com.dive.orchestrator.service.AdvisoryLockManager;
import com.dive.orchestrator.service.CheckpointStore;
import com.dive.orchestrator.service.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Drives the fixed phase sequence for one instance.
 *
 * <ol>
 *   <li>Acquire the instance lock; contention ends the run without side effects.</li>
 *   <li>Skip every phase that already has a checkpoint (resume).</li>
 *   <li>Run the next phase's handler under the circuit breaker of the
 *       phase's downstream dependency.</li>
 *   <li>Success: step row, checkpoint, duration metric, state, lock renewal.</li>
 *   <li>Failure: record the error, then let its classification decide.
 *       Recoverable errors are retried with backoff; an open breaker, a
 *       fatal error or an exhausted budget triggers rollback.</li>
 *   <li>Independently, more than {@code failure-threshold} failures in one
 *       run abort it.</li>
 * </ol>
 * COMPLETE is absorbing: a second run is a no-op. FAILED and ROLLED_BACK
 * need {@link #reset} first.
 *
 * One run is strictly sequential. Runs for different instances are
 * independent and may execute on different threads at the same time.
 */
@Service
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final StateStore               stateStore;
    private final AdvisoryLockManager      lockManager;
    private final CheckpointStore          checkpointStore;
    private final CircuitBreakerRegistry   breakers;
    private final ErrorClassifier          classifier;
    private final PhaseRegistry            phaseRegistry;
    private final RollbackService          rollbackService;
    private final DeploymentStepRepository stepRepo;
    private final MetricRepository         metricRepo;
    private final FederationClient         federation;
    private final MeterRegistry            meterRegistry;
    private final RetryPolicy              retryPolicy;
    private final Clock                    clock;
    private final Duration                 lockTimeout;
    private final int                      failureThreshold;

    public PipelineExecutor(StateStore stateStore,
                            AdvisoryLockManager lockManager,
                            CheckpointStore checkpointStore,
                            CircuitBreakerRegistry breakers,
                            ErrorClassifier classifier,
                            PhaseRegistry phaseRegistry,
                            RollbackService rollbackService,
                            DeploymentStepRepository stepRepo,
                            MetricRepository metricRepo,
                            FederationClient federation,
                            MeterRegistry meterRegistry,
                            RetryPolicy retryPolicy,
                            Clock clock,
                            @Value("${dive.orchestrator.lock.acquire-timeout:30s}") Duration lockTimeout,
                            @Value("${dive.orchestrator.failure-threshold:5}") int failureThreshold) {
        this.stateStore       = stateStore;
        this.lockManager      = lockManager;
        this.checkpointStore  = checkpointStore;
        this.breakers         = breakers;
        this.classifier       = classifier;
        this.phaseRegistry    = phaseRegistry;
        this.rollbackService  = rollbackService;
        this.stepRepo         = stepRepo;
        this.metricRepo       = metricRepo;
        this.federation       = federation;
        this.meterRegistry    = meterRegistry;
        this.retryPolicy      = retryPolicy;
        this.clock            = clock;
        this.lockTimeout      = lockTimeout;
        this.failureThreshold = failureThreshold;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    public PipelineResult run(String instanceCode, PipelineMode mode) {
        String code = StateStore.normalize(instanceCode);
        long started = System.nanoTime();
        MDC.put("instance", code);
        try {
            PipelineResult result = withLock(code, "pipeline " + mode.argument(),
                    holder -> runLocked(code, holder, mode));
            result = result.withDuration(Duration.ofNanos(System.nanoTime() - started).toSeconds());
            meterRegistry.counter("dive.pipeline.runs", "outcome", result.status().name().toLowerCase())
                    .increment();
            log.info("Pipeline {} for {} finished: {}", mode, code, result.status());
            return result;
        } finally {
            MDC.remove("instance");
            MDC.remove("phase");
            MDC.remove("attempt");
        }
    }

    /**
     * Operator rollback: stop services and restore the newest checkpoint,
     * whatever the current state.
     */
    public PipelineResult forceRollback(String instanceCode) {
        String code = StateStore.normalize(instanceCode);
        MDC.put("instance", code);
        try {
            return withLock(code, "force-rollback", holder -> {
                DeploymentState current = stateStore.getState(code);
                Phase phase = phaseOf(current).orElse(null);
                return rollbackAndFinish(code, phase, RollbackStrategy.COMPLETE,
                        ErrorClassification.of(ErrorCode.STATE_ROLLBACK), null,
                        "Operator-initiated rollback from " + current);
            });
        } finally {
            MDC.remove("instance");
        }
    }

    /**
     * Clear every checkpoint and return the instance to UNKNOWN so the next
     * run starts from the first phase.
     *
     * @throws IllegalArgumentException if the confirmation token is wrong
     * @throws LockContentionException  if a pipeline holds the instance
     */
    public long reset(String instanceCode, String confirmation) {
        String code = StateStore.normalize(instanceCode);
        String holder = AdvisoryLockManager.newHolderId();
        if (!lockManager.acquire(code, holder, Duration.ZERO)) {
            throw new LockContentionException(code);
        }
        try {
            long cleared = checkpointStore.clearAll(code, confirmation);
            stateStore.reset(code, "operator reset, " + cleared + " checkpoints cleared");
            return cleared;
        } finally {
            lockManager.release(code, holder);
        }
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    private PipelineResult runLocked(String code, String holder, PipelineMode mode) {
        DeploymentState current = stateStore.getState(code);
        if (current == DeploymentState.COMPLETE) {
            log.info("{} is already COMPLETE; nothing to do", code);
            return PipelineResult.success(code, PipelineStatus.ALREADY_COMPLETE);
        }
        if (current.requiresReset()) {
            log.warn("{} is {}; reset it before running again", code, current);
            return new PipelineResult(code, PipelineStatus.REQUIRES_RESET, null, null, null,
                    "Reset the instance (clears checkpoints) before running the pipeline again.",
                    "Instance is " + current, checkpointStore.canResume(code), 0);
        }

        RunState run = new RunState();
        for (Phase phase : Phase.values()) {
            MDC.put("phase", phase.name());
            MDC.remove("attempt");

            if (checkpointStore.isComplete(code, phase)) {
                log.debug("{} already checkpointed, skipping", phase);
                continue;
            }
            if (phase == Phase.COMPLETE) {
                return complete(code, mode);
            }
            if (!mode.runs(phase)) {
                log.info("{} not part of mode {}, marking skipped", phase, mode);
                checkpointStore.markComplete(code, phase, Duration.ZERO,
                        Map.of("skipped", true, "mode", mode.argument()));
                continue;
            }

            Optional<PipelineResult> failure = runPhase(code, phase, mode, run);
            if (failure.isPresent()) {
                return failure.get();
            }
            if (!lockManager.renew(code, holder) && !lockManager.acquire(code, holder, Duration.ZERO)) {
                LockContentionException e = new LockContentionException(code);
                ErrorClassification c = classifier.classify(e);
                classifier.record(code, c, "pipeline", "Lock lost after " + phase, Map.of("phase", phase.name()));
                return PipelineResult.failure(code, PipelineStatus.LOCK_CONTENTION, phase.next().orElse(null),
                        c, e.getMessage(), checkpointStore.canResume(code));
            }
        }
        return PipelineResult.success(code, PipelineStatus.ALREADY_COMPLETE);
    }

    /**
     * Run one phase with retries.
     *
     * @return empty on success, the final result of the run otherwise
     */
    private Optional<PipelineResult> runPhase(String code, Phase phase, PipelineMode mode, RunState run) {
        String breaker = phase.breakerKey().orElseThrow();

        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            MDC.put("attempt", String.valueOf(attempt));
            DeploymentStep step = new DeploymentStep(code, phase, attempt, clock.instant());
            step.setStatus(StepStatus.IN_PROGRESS);
            step = stepRepo.save(step);

            Timer.Sample sample = Timer.start(meterRegistry);
            long started = System.nanoTime();
            try {
                PhaseHandler handler = phaseRegistry.get(phase);
                log.info("Running {} (attempt {}/{})", phase, attempt, retryPolicy.maxAttempts());
                breakers.run(breaker, () -> handler.execute(code, mode));

                Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                recordSuccess(code, phase, mode, step, attempt, elapsed);
                sample.stop(phaseTimer(phase, "success"));
                return Optional.empty();
            } catch (RuntimeException e) {
                sample.stop(phaseTimer(phase, "failure"));
                ErrorClassification c = classifier.classify(e);

                step.setStatus(StepStatus.FAILED);
                step.setErrorCode(c.code().code());
                step.setFinishedAt(clock.instant());
                stepRepo.save(step);
                classifier.record(code, c, "phase:" + phase.name(), e.getMessage(),
                        Map.of("attempt", attempt, "mode", mode.argument(), "breaker", breaker));
                run.failures++;

                if (run.failures > failureThreshold) {
                    log.error("{} failures in this run exceed the threshold of {}; aborting",
                            run.failures, failureThreshold);
                    ErrorClassification abort = ErrorClassification.of(ErrorCode.FAILURE_THRESHOLD_EXCEEDED);
                    classifier.record(code, abort, "pipeline", run.failures + " failures in one run",
                            Map.of("phase", phase.name(), "threshold", failureThreshold));
                    return Optional.of(rollbackAndFinish(code, phase, phase.rollbackStrategy(), abort,
                            PipelineStatus.ABORTED_THRESHOLD, e.getMessage()));
                }
                if (e instanceof CircuitOpenException) {
                    log.error("{} short-circuited by breaker '{}'; no further attempts", phase, breaker);
                    return Optional.of(fail(code, phase, c, e.getMessage()));
                }
                if (!c.recoverable()) {
                    log.error("{} failed fatally with {}: {}", phase, c.code(), e.getMessage());
                    return Optional.of(fail(code, phase, c, e.getMessage()));
                }
                if (attempt == retryPolicy.maxAttempts()) {
                    log.error("{} failed {} times; retry budget exhausted", phase, attempt);
                    return Optional.of(fail(code, phase, c, e.getMessage()));
                }

                Duration delay = retryPolicy.delayAfter(attempt);
                log.warn("{} failed with recoverable {} ({}); retrying in {} ms",
                        phase, c.code(), e.getMessage(), delay.toMillis());
                if (!sleep(delay)) {
                    return Optional.of(fail(code, phase, c, "Interrupted while waiting to retry " + phase));
                }
            }
        }
        throw new IllegalStateException("unreachable: retry loop exited without a verdict");
    }

    private void recordSuccess(String code, Phase phase, PipelineMode mode, DeploymentStep step,
                               int attempt, Duration elapsed) {
        step.setStatus(StepStatus.COMPLETED);
        step.setFinishedAt(clock.instant());
        stepRepo.save(step);

        checkpointStore.markComplete(code, phase, elapsed, Map.of("attempts", attempt, "mode", mode.argument()));
        metricRepo.save(new OrchestrationMetric(code, OrchestrationMetric.PHASE_DURATION + phase.name(),
                elapsed.toMillis() / 1000.0, "seconds", null, clock.instant()));
        stateStore.setState(code, DeploymentState.of(phase), phase + " completed", Map.of("attempts", attempt));
        log.info("{} completed in {} ms", phase, elapsed.toMillis());
    }

    private PipelineResult complete(String code, PipelineMode mode) {
        checkpointStore.markComplete(code, Phase.COMPLETE, Duration.ZERO, Map.of("mode", mode.argument()));
        stateStore.setState(code, DeploymentState.COMPLETE, "pipeline completed", null);

        if (federation.reconcilesOnComplete()) {
            try {
                federation.reconcile(code);
            } catch (FederationException e) {
                classifier.record(code, e.getErrorCode(), e.getErrorCode().severity(),
                        "federation", e.getMessage(), Map.of("endpoint", "/reconcile"));
            }
        }
        return PipelineResult.success(code, PipelineStatus.COMPLETED);
    }

    // ------------------------------------------------------------------
    // Failure handling
    // ------------------------------------------------------------------

    private PipelineResult fail(String code, Phase phase, ErrorClassification c, String message) {
        return rollbackAndFinish(code, phase, phase.rollbackStrategy(), c, null, message);
    }

    /**
     * Roll back and move the instance to its terminal state: ROLLED_BACK
     * when a checkpoint was restored, FAILED otherwise, and FAILED with
     * rollback_failed metadata when the rollback itself broke.
     *
     * @param status reported status; null derives it from the rollback outcome
     */
    private PipelineResult rollbackAndFinish(String code, Phase phase, RollbackStrategy strategy,
                                             ErrorClassification c, PipelineStatus status, String message) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (phase != null) metadata.put("failed_phase", phase.name());
        metadata.put("error_code", c.code().code());

        try {
            RollbackOutcome outcome = rollbackService.rollback(code, strategy, String.valueOf(message));
            DeploymentState terminal = outcome.restored() ? DeploymentState.ROLLED_BACK : DeploymentState.FAILED;
            if (outcome.restored()) metadata.put("restored_phase", outcome.restoredPhase().name());
            stateStore.setState(code, terminal,
                    phase != null ? c.code() + " in " + phase : c.code().name(), metadata);

            PipelineStatus reported = status != null ? status
                    : outcome.restored() ? PipelineStatus.ROLLED_BACK : PipelineStatus.FAILED;
            return PipelineResult.failure(code, reported, phase, c, message, checkpointStore.canResume(code));
        } catch (RollbackFailedException e) {
            log.error("Rollback of {} failed; manual recovery needed", code, e);
            metadata.put("rollback_failed", true);
            stateStore.setState(code, DeploymentState.FAILED, "rollback failed", metadata);
            return PipelineResult.failure(code, PipelineStatus.ROLLBACK_FAILED, phase,
                    classifier.classify(e), e.getMessage(), false);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineResult withLock(String code, String purpose, Function<String, PipelineResult> body) {
        String holder = AdvisoryLockManager.newHolderId();
        if (!lockManager.acquire(code, holder, lockTimeout)) {
            LockContentionException e = new LockContentionException(code);
            ErrorClassification c = classifier.classify(e);
            classifier.record(code, c, "pipeline", e.getMessage(), Map.of("purpose", purpose));
            return PipelineResult.failure(code, PipelineStatus.LOCK_CONTENTION, null, c, e.getMessage(),
                    checkpointStore.canResume(code));
        }
        try {
            return body.apply(holder);
        } finally {
            lockManager.release(code, holder);
        }
    }

    private Timer phaseTimer(Phase phase, String outcome) {
        return meterRegistry.timer("dive.phase.duration", "phase", phase.name(), "outcome", outcome);
    }

    private static Optional<Phase> phaseOf(DeploymentState state) {
        try {
            return Optional.of(Phase.valueOf(state.name()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) return true;
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Counters for one invocation. */
    private static final class RunState {
        int failures;
    }
}
