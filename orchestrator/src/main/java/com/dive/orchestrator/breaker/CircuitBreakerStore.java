package com.dive.orchestrator.breaker;

import com.dive.orchestrator.error.CircuitOpenException;
import com.dive.orchestrator.model.CircuitBreakerRecord;
import com.dive.orchestrator.model.CircuitState;
import com.dive.orchestrator.repository.CircuitBreakerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable breaker state machine.
 *
 * Each public method is one short transaction that reads the breaker row
 * with SELECT ... FOR UPDATE, so concurrent pipelines (threads or separate
 * processes) see every transition in order. The guarded call itself runs
 * outside these transactions; see {@link CircuitBreakerRegistry#execute}.
 */
@Component
public class CircuitBreakerStore {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerStore.class);

    private final CircuitBreakerRepository repo;
    private final Clock                    clock;
    private final int                      failureThreshold;
    private final Duration                 window;
    private final Duration                 cooldown;
    private final Duration                 maxCooldown;

    public CircuitBreakerStore(CircuitBreakerRepository repo,
                               Clock clock,
                               @Value("${dive.orchestrator.circuit-breaker.failure-threshold:5}") int failureThreshold,
                               @Value("${dive.orchestrator.circuit-breaker.window:10m}") Duration window,
                               @Value("${dive.orchestrator.circuit-breaker.cooldown:60s}") Duration cooldown,
                               @Value("${dive.orchestrator.circuit-breaker.max-cooldown:15m}") Duration maxCooldown) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("circuit-breaker.failure-threshold must be >= 1");
        }
        this.repo             = repo;
        this.clock            = clock;
        this.failureThreshold = failureThreshold;
        this.window           = window;
        this.cooldown         = cooldown;
        this.maxCooldown      = maxCooldown;
    }

    /** Create the breaker in CLOSED state if it does not exist yet. */
    @Transactional
    public void init(String operation) {
        if (repo.insertIfAbsent(operation, clock.instant()) > 0) {
            log.info("Circuit '{}' initialized (CLOSED)", operation);
        }
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /**
     * Decide whether a call may proceed.
     *
     * OPEN past its retry_after moves to HALF_OPEN and the caller becomes the
     * single trial. A HALF_OPEN breaker with a trial in flight rejects,
     * unless that trial has been running longer than the cool-down (its
     * caller most likely died).
     *
     * @throws CircuitOpenException when the call must not be attempted
     */
    @Transactional
    public void acquirePermission(String operation) {
        CircuitBreakerRecord cb = lockOrCreate(operation);
        Instant now = clock.instant();

        switch (cb.getState()) {
            case CLOSED -> { }
            case OPEN -> {
                if (cb.getRetryAfter() != null && now.isBefore(cb.getRetryAfter())) {
                    throw new CircuitOpenException(operation, cb.getRetryAfter());
                }
                cb.setState(CircuitState.HALF_OPEN);
                cb.setTrialStartedAt(now);
                log.info("Circuit '{}' OPEN -> HALF_OPEN, trial call allowed", operation);
            }
            case HALF_OPEN -> {
                Instant trial = cb.getTrialStartedAt();
                if (trial != null && now.isBefore(trial.plus(cooldown))) {
                    throw new CircuitOpenException(operation, trial.plus(cooldown));
                }
                cb.setTrialStartedAt(now);
                log.info("Circuit '{}' HALF_OPEN trial call allowed", operation);
            }
        }
        cb.setUpdatedAt(now);
        repo.save(cb);
    }

    @Transactional
    public void recordSuccess(String operation) {
        CircuitBreakerRecord cb = lockOrCreate(operation);
        Instant now = clock.instant();
        CircuitState before = cb.getState();

        cb.setState(CircuitState.CLOSED);
        cb.setFailureCount(0);
        cb.setOpenCount(0);
        cb.setWindowStartedAt(null);
        cb.setOpenedAt(null);
        cb.setRetryAfter(null);
        cb.setTrialStartedAt(null);
        cb.incrementSuccessCount();
        cb.setLastSuccessAt(now);
        cb.setUpdatedAt(now);
        repo.save(cb);

        if (before != CircuitState.CLOSED) {
            log.info("Circuit '{}' {} -> CLOSED", operation, before);
        }
    }

    @Transactional
    public void recordFailure(String operation) {
        CircuitBreakerRecord cb = lockOrCreate(operation);
        Instant now = clock.instant();
        cb.setLastFailureAt(now);
        cb.setUpdatedAt(now);

        switch (cb.getState()) {
            case HALF_OPEN -> open(cb, now, "trial call failed");
            case OPEN      -> cb.setFailureCount(cb.getFailureCount() + 1);
            case CLOSED    -> {
                Instant windowStart = cb.getWindowStartedAt();
                if (windowStart == null || !now.isBefore(windowStart.plus(window))) {
                    cb.setWindowStartedAt(now);
                    cb.setFailureCount(0);
                }
                cb.setFailureCount(cb.getFailureCount() + 1);
                if (cb.getFailureCount() >= failureThreshold) {
                    open(cb, now, cb.getFailureCount() + " failures within " + window);
                } else {
                    log.debug("Circuit '{}' failure {}/{}", operation, cb.getFailureCount(), failureThreshold);
                }
            }
        }
        repo.save(cb);
    }

    /**
     * End a HALF_OPEN trial that produced no verdict on the dependency.
     * The breaker stays HALF_OPEN and the next caller becomes the trial.
     */
    @Transactional
    public void releaseTrial(String operation) {
        CircuitBreakerRecord cb = lockOrCreate(operation);
        if (cb.getState() != CircuitState.HALF_OPEN || cb.getTrialStartedAt() == null) return;
        cb.setTrialStartedAt(null);
        cb.setUpdatedAt(clock.instant());
        repo.save(cb);
        log.info("Circuit '{}' HALF_OPEN trial released without a verdict", operation);
    }

    /** Force CLOSED with zeroed counters. */
    @Transactional
    public void reset(String operation) {
        CircuitBreakerRecord cb = lockOrCreate(operation);
        cb.setState(CircuitState.CLOSED);
        cb.setFailureCount(0);
        cb.setOpenCount(0);
        cb.setWindowStartedAt(null);
        cb.setOpenedAt(null);
        cb.setRetryAfter(null);
        cb.setTrialStartedAt(null);
        cb.setUpdatedAt(clock.instant());
        repo.save(cb);
        log.warn("Circuit '{}' manually reset to CLOSED", operation);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<CircuitBreakerRecord> find(String operation) {
        return repo.findById(operation);
    }

    @Transactional(readOnly = true)
    public List<CircuitBreakerRecord> findAll() {
        return repo.findAllByOrderByOperationNameAsc();
    }

    /**
     * Cool-down for the n-th consecutive opening: cooldown * 2^(n-1),
     * capped at max-cooldown.
     */
    Duration backoffFor(int openCount) {
        int exponent = Math.min(Math.max(0, openCount - 1), 20);
        Duration backoff = cooldown.multipliedBy(1L << exponent);
        return backoff.compareTo(maxCooldown) > 0 ? maxCooldown : backoff;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void open(CircuitBreakerRecord cb, Instant now, String why) {
        int openCount = cb.getOpenCount() + 1;
        Duration backoff = backoffFor(openCount);
        cb.setState(CircuitState.OPEN);
        cb.setOpenCount(openCount);
        cb.setOpenedAt(now);
        cb.setRetryAfter(now.plus(backoff));
        cb.setTrialStartedAt(null);
        log.warn("Circuit '{}' OPEN ({}), retry after {}", cb.getOperationName(), why, backoff);
    }

    private CircuitBreakerRecord lockOrCreate(String operation) {
        Optional<CircuitBreakerRecord> row = repo.lockByOperationName(operation);
        if (row.isPresent()) return row.get();
        repo.insertIfAbsent(operation, clock.instant());
        return repo.lockByOperationName(operation)
                .orElseThrow(() -> new IllegalStateException("Circuit row missing after insert: " + operation));
    }
}
