package wikigate.core.model.resilience;

import java.time.Duration;

/**
 * Thresholds for a per-mirror circuit breaker.
 *
 * @param failureThreshold consecutive counted failures that open the circuit
 * @param resetTimeout     time after the last failure before a probe is admitted
 */
public record CircuitBreakerPolicy(int failureThreshold, Duration resetTimeout) {

    public CircuitBreakerPolicy {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1, got: " + failureThreshold);
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be a non-negative duration");
        }
    }
}
