package com.dive.orchestrator.pipeline;

import com.dive.orchestrator.error.ErrorCode;
import com.dive.orchestrator.error.ErrorClassifier;
import com.dive.orchestrator.error.RollbackFailedException;
import com.dive.orchestrator.error.Severity;
import com.dive.orchestrator.model.Checkpoint;
import com.dive.orchestrator.model.RollbackStrategy;
import com.dive.orchestrator.scheduler.ServiceController;
import com.dive.orchestrator.service.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Undo a failed phase according to its rollback strategy.
 *
 * STOP halts the instance's services; CONFIG restores the newest checkpoint
 * (snapshot copy plus one state-store rollback step). Setting the terminal
 * state is left to the caller, which knows why the rollback happened.
 */
@Service
public class RollbackService {

    private static final Logger log = LoggerFactory.getLogger(RollbackService.class);

    private final CheckpointStore   checkpointStore;
    private final ServiceController serviceController;
    private final ErrorClassifier   classifier;

    public RollbackService(CheckpointStore checkpointStore,
                           ServiceController serviceController,
                           ErrorClassifier classifier) {
        this.checkpointStore   = checkpointStore;
        this.serviceController = serviceController;
        this.classifier        = classifier;
    }

    /**
     * @return which checkpoint, if any, was restored
     * @throws RollbackFailedException if stopping services or restoring the
     *         snapshot fails; the failure is recorded as a critical error first
     */
    public RollbackOutcome rollback(String instanceCode, RollbackStrategy strategy, String reason) {
        log.warn("Rolling back {} with strategy {} ({})", instanceCode, strategy, reason);
        try {
            if (strategy.stopsServices()) {
                serviceController.stopAll(instanceCode);
            }
            if (!strategy.restoresConfig()) {
                return new RollbackOutcome(strategy, null);
            }

            Optional<Checkpoint> checkpoint = checkpointStore.latest(instanceCode);
            if (checkpoint.isEmpty()) {
                log.warn("No checkpoint for {}; nothing to restore", instanceCode);
                return new RollbackOutcome(strategy, null);
            }
            checkpointStore.restore(instanceCode, checkpoint.get());
            log.info("{} restored to checkpoint {}", instanceCode, checkpoint.get().getPhase());
            return new RollbackOutcome(strategy, checkpoint.get().getPhase());
        } catch (RuntimeException e) {
            classifier.record(instanceCode, ErrorCode.ROLLBACK_FAILED, Severity.CRITICAL,
                    "rollback", e.getMessage(),
                    Map.of("strategy", strategy.name(), "reason", String.valueOf(reason)));
            throw new RollbackFailedException("Rollback of " + instanceCode + " failed: " + e.getMessage(), e);
        }
    }
}
