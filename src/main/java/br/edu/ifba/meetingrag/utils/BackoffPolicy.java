package br.edu.ifba.meetingrag.utils;

import java.time.Duration;

/**
 * Exponential backoff with an attempt ceiling.
 *
 * <p>Attempt numbers are 1-based. The delay before attempt {@code n + 1} is
 * {@code baseDelay * multiplier^(n - 1)}, capped at {@code maxDelay}.</p>
 *
 * @param maxAttempts total attempts allowed, including the first one
 * @param baseDelay delay after the first failed attempt
 * @param multiplier growth factor between consecutive delays
 * @param maxDelay upper bound for any single delay
 */
public record BackoffPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay) {

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofMinutes(5));
    }

    /**
     * Policy that never waits, for callers that retry elsewhere.
     */
    public static BackoffPolicy immediate(int maxAttempts) {
        return new BackoffPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Delay to wait after {@code failedAttempt} failed attempts before trying again.
     *
     * @param failedAttempt number of attempts that have failed so far (1-based)
     * @return the backoff delay, never longer than {@link #maxDelay()}
     */
    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            return Duration.ZERO;
        }
        double factor = Math.pow(multiplier, failedAttempt - 1);
        double millis = baseDelay.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * Whether another attempt is allowed after {@code attemptsMade} attempts.
     */
    public boolean isExhausted(int attemptsMade) {
        return attemptsMade >= maxAttempts;
    }
}
