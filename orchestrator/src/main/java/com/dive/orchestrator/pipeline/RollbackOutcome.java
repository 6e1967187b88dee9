package com.dive.orchestrator.pipeline;

import com.dive.orchestrator.model.Phase;
import com.dive.orchestrator.model.RollbackStrategy;

/**
 * @param restoredPhase checkpoint whose snapshot was restored; null when none was
 */
public record RollbackOutcome(RollbackStrategy strategy, Phase restoredPhase) {

    public boolean restored() {
        return restoredPhase != null;
    }
}
