package com.dive.orchestrator.error;

/**
 * Error severity, persisted as its numeric level (1 = most severe).
 */
public enum Severity {
    CRITICAL(1),
    HIGH(2),
    MEDIUM(3),
    LOW(4),
    INFO(5);

    private final int level;

    Severity(int level) { this.level = level; }

    public int level() { return level; }

    public static Severity ofLevel(int level) {
        for (Severity s : values()) {
            if (s.level == level) return s;
        }
        throw new IllegalArgumentException("Severity level out of range 1-5: " + level);
    }
}
