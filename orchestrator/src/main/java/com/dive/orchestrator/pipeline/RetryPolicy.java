package com.dive.orchestrator.pipeline;

import java.time.Duration;

/**
 * Per-phase retry budget with exponential backoff.
 *
 * Delay before attempt n+1 is {@code initialDelay * multiplier^(n-1)},
 * capped at {@code maxDelay}.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("retry.max-attempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("retry.multiplier must be >= 1.0");
        }
    }

    /** Delay to wait after failed attempt number {@code attempt} (1-based). */
    public Duration delayAfter(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
