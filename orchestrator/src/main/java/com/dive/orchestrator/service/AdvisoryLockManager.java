package com.dive.orchestrator.service;

import com.dive.orchestrator.model.DeploymentLock;
import com.dive.orchestrator.repository.DeploymentLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-instance advisory lock backed by the deployment_locks table.
 *
 * <ul>
 *   <li>Scoped per instance code: pipelines for different instances never contend.</li>
 *   <li>Re-entrant per holder: a holder that already owns the lock gets it again
 *       and must release it as many times.</li>
 *   <li>Bounded: every lock carries expires_at. A holder that died without
 *       releasing stops blocking others once its lock expires.</li>
 * </ul>
 * Locks are advisory; reads of deployment state never consult them.
 */
@Service
public class AdvisoryLockManager {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryLockManager.class);

    private final DeploymentLockRepository lockRepo;
    private final Clock                    clock;
    private final Duration                 ttl;
    private final Duration                 pollInterval;

    public AdvisoryLockManager(DeploymentLockRepository lockRepo,
                               Clock clock,
                               @Value("${dive.orchestrator.lock.ttl:1h}") Duration ttl,
                               @Value("${dive.orchestrator.lock.poll-interval:500ms}") Duration pollInterval) {
        this.lockRepo     = lockRepo;
        this.clock        = clock;
        this.ttl          = ttl;
        this.pollInterval = pollInterval;
    }

    /**
     * A holder identity unique to one pipeline run in this process:
     * {@code <pid@host>:<random>}.
     */
    public static String newHolderId() {
        return ManagementFactory.getRuntimeMXBean().getName()
                + ":" + UUID.randomUUID().toString().substring(0, 8);
    }

    // ------------------------------------------------------------------
    // Acquire / release
    // ------------------------------------------------------------------

    /**
     * Try to take the lock, polling until {@code timeout} has elapsed.
     * A zero timeout makes exactly one attempt.
     *
     * @return true when the holder owns the lock on return
     */
    public boolean acquire(String instanceCode, String holder, Duration timeout) {
        String code = StateStore.normalize(instanceCode);
        long deadline = System.nanoTime() + Math.max(0, timeout.toNanos());

        while (true) {
            Instant now = clock.instant();
            if (lockRepo.tryAcquire(code, holder, now, now.plus(ttl)) > 0) {
                log.info("Lock on {} acquired by {}", code, holder);
                return true;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Lock on {} not acquired by {} within {}", code, holder, timeout);
                return false;
            }
            if (!sleep(Math.min(remaining, pollInterval.toNanos()))) {
                return false;
            }
        }
    }

    /**
     * Drop one hold. The row is deleted when the last hold goes.
     *
     * @return false when {@code holder} did not own the lock
     */
    public boolean release(String instanceCode, String holder) {
        String code = StateStore.normalize(instanceCode);
        if (lockRepo.decrementHold(code, holder) > 0) {
            log.debug("Lock on {} re-entrant hold released by {}", code, holder);
            return true;
        }
        boolean released = lockRepo.deleteHeld(code, holder) > 0;
        if (released) {
            log.info("Lock on {} released by {}", code, holder);
        } else {
            log.warn("Release of {} by {} ignored: not the holder", code, holder);
        }
        return released;
    }

    /** Push expires_at a full TTL into the future; false if the lock was lost. */
    public boolean renew(String instanceCode, String holder) {
        Instant now = clock.instant();
        return lockRepo.extend(StateStore.normalize(instanceCode), holder, now, now.plus(ttl)) > 0;
    }

    /** Operator action: remove the lock regardless of holder. */
    public boolean forceRelease(String instanceCode) {
        String code = StateStore.normalize(instanceCode);
        boolean removed = lockRepo.forceDelete(code) > 0;
        log.warn("Lock on {} force-released (present={})", code, removed);
        return removed;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** True while some holder owns a lock that has not expired. */
    public boolean isHeld(String instanceCode) {
        return current(instanceCode).isPresent();
    }

    /** The live lock row, if any; expired rows count as absent. */
    public Optional<DeploymentLock> current(String instanceCode) {
        Instant now = clock.instant();
        return lockRepo.findById(StateStore.normalize(instanceCode))
                .filter(lock -> !lock.isExpired(now));
    }

    private static boolean sleep(long nanos) {
        try {
            Thread.sleep(Duration.ofNanos(nanos).toMillis(), (int) (nanos % 1_000_000));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
