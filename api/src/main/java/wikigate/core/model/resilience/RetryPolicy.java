package wikigate.core.model.resilience;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry-with-exponential-backoff parameters.
 *
 * <p>An operation is tried at most {@code maxRetries + 1} times. The first
 * wait is {@code baseDelay}; each following wait is the previous one times
 * {@code backoffMultiplier}, capped at {@code maxDelay}.
 *
 * @param maxRetries        retries after the first attempt
 * @param baseDelay         wait before the first retry
 * @param maxDelay          upper bound for any wait
 * @param backoffMultiplier growth factor between waits, at least 1
 * @param retryable         decides whether a failure may be retried
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        double backoffMultiplier,
        Predicate<Throwable> retryable) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got: " + maxRetries);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0, got: " + backoffMultiplier);
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Require 0 <= baseDelay <= maxDelay");
        }
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    /**
     * Computes the wait that follows {@code current}.
     */
    public Duration nextDelay(Duration current) {
        final var next = (long) (current.toMillis() * backoffMultiplier);
        return Duration.ofMillis(Math.min(next, maxDelay.toMillis()));
    }
}
