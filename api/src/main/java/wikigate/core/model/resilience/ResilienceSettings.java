package wikigate.core.model.resilience;

import java.time.Duration;

/**
 * Resilience parameters shared by every endpoint manager.
 *
 * @param retryPolicy    retry limits for whole mirror passes
 * @param breakerPolicy  per-mirror breaker thresholds
 * @param requestTimeout bound for a single mirror attempt
 */
public record ResilienceSettings(
        RetryPolicy retryPolicy, CircuitBreakerPolicy breakerPolicy, Duration requestTimeout) {}
