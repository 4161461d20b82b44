package com.armada.core.concurrent;

import com.armada.core.error.ArmadaException;
import com.armada.core.error.ErrorKind;

import java.time.Duration;

/**
 * Bounded retry policy shared by the task scheduler (typed retry counter) and the
 * execution coordinator (per-task attempt loop).
 *
 * @param maxAttempts total attempts including the first one
 * @param backoff     base delay before a retry; doubled for every further attempt
 */
public record RetryPolicy(int maxAttempts, Duration backoff) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofMillis(250));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        backoff = backoff == null ? Duration.ZERO : backoff;
    }

    /**
     * @param attemptsMade attempts already made (1 after the first failure)
     */
    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay to wait before attempt number {@code attempt + 1}.
     */
    public Duration delayAfter(int attemptsMade) {
        if (backoff.isZero() || attemptsMade < 1) {
            return Duration.ZERO;
        }
        long factor = 1L << Math.min(attemptsMade - 1, 10);
        return backoff.multipliedBy(factor);
    }

    /**
     * Only execution failures are transient. Quota, capacity, timeout and cancellation
     * failures go back to the caller untouched.
     */
    public boolean isRetryable(ArmadaException error) {
        return error.kind() == ErrorKind.EXECUTION_FAILED;
    }
}
