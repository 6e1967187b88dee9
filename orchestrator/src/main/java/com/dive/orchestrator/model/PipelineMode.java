package com.dive.orchestrator.model;

import java.util.Locale;

/**
 * How much of the phase list a pipeline run covers.
 *
 *   DEPLOY   : every phase, including first-time data seeding
 *   UP       : bring an already-initialized instance up (skips INITIALIZATION and SEEDING)
 *   REDEPLOY : full redeploy over existing data (skips SEEDING)
 */
public enum PipelineMode {
    DEPLOY,
    UP,
    REDEPLOY;

    public boolean runs(Phase phase) {
        return switch (this) {
            case DEPLOY   -> true;
            case UP       -> phase != Phase.INITIALIZATION && phase != Phase.SEEDING;
            case REDEPLOY -> phase != Phase.SEEDING;
        };
    }

    public String argument() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PipelineMode parse(String value) {
        if (value == null || value.isBlank()) return DEPLOY;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown pipeline mode: " + value, e);
        }
    }
}
