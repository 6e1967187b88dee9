package com.dive.orchestrator.service;

import com.dive.orchestrator.model.Phase;

import java.util.List;

/**
 * Result of checking that an instance's completed phases form a prefix of
 * the phase order.
 *
 * @param gaps phases not completed although a later phase is
 */
public record CheckpointValidation(
        String      instanceCode,
        boolean     consistent,
        List<Phase> completed,
        List<Phase> gaps
) {}
