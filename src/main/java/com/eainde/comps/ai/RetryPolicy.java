package com.eainde.comps.ai;

import java.time.Duration;

/**
 * Bounded exponential backoff shared by every model call.
 *
 * <pre>
 *   attempt 1 → call
 *   attempt 2 → wait initialBackoff, call
 *   attempt 3 → wait initialBackoff × multiplier, call
 *   ...        (each wait capped at maxBackoff)
 * </pre>
 *
 * @param maxAttempts    total calls including the first, at least 1
 * @param initialBackoff wait before the second attempt
 * @param multiplier     growth factor between consecutive waits
 * @param maxBackoff     upper bound for any single wait
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        double multiplier,
        Duration maxBackoff
) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    /** 3 attempts, 1s initial, doubling, 8s cap. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(8));
    }

    /**
     * Wait before the given attempt (1-based). Attempt 1 never waits.
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) return Duration.ZERO;
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 2);
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
