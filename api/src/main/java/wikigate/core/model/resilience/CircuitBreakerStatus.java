package wikigate.core.model.resilience;

import java.time.Instant;

/**
 * Point-in-time view of one circuit breaker.
 *
 * @param state           current state
 * @param failureCount    consecutive counted failures
 * @param lastFailureTime time of the last counted failure, or {@code null} if none
 */
public record CircuitBreakerStatus(CircuitState state, int failureCount, Instant lastFailureTime) {}
