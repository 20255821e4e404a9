package com.questrail.cncsim.publish;

import java.time.Duration;
import java.util.Objects;

/**
 * RetryPolicy
 * -----------------------------------------------------------------------------
 * Bounded exponential backoff for message delivery.
 *
 * <p>The delay before attempt {@code n + 1}, after attempt {@code n} failed, is
 * {@code min(baseDelay × 2^(n-1), maxDelay)}. With the defaults this yields
 * 1000 ms, 2000 ms, 4000 ms, 5000 ms, 5000 ms, ...</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>maxAttempts</b>: total delivery attempts including the first one</li>
 *   <li><b>baseDelay</b>: delay after the first failed attempt</li>
 *   <li><b>maxDelay</b>: ceiling for any single delay</li>
 * </ul>
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay)
{
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(1000);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(5000);

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    public static RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * Delay to wait after {@code failedAttempt} (1-based) failed.
     */
    public Duration backoffFor(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1");
        }
        int shift = Math.min(failedAttempt - 1, 30);
        long millis = baseDelay.toMillis() << shift;
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    /**
     * Sum of every backoff a fully failing delivery waits through; bounds how
     * long an in-flight publish can take beyond its attempts.
     */
    public Duration worstCaseBackoff() {
        Duration total = Duration.ZERO;
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            total = total.plus(backoffFor(attempt));
        }
        return total;
    }
}
