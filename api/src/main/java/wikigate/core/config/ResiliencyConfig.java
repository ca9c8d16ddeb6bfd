package wikigate.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for upstream resiliency settings.
 *
 * <p>Configuration prefix: {@code wikigate.resiliency}
 *
 * <p>This configuration controls:
 * <ul>
 *   <li>HTTP request timeout and user agent</li>
 *   <li>Retry with exponential backoff across mirror passes</li>
 *   <li>Per-mirror circuit breaker thresholds</li>
 * </ul>
 */
@ConfigMapping(prefix = "wikigate.resiliency")
public interface ResiliencyConfig {

    /**
     * Outbound HTTP settings.
     */
    HttpConfig http();

    /**
     * Retry settings.
     */
    RetryConfig retry();

    /**
     * Circuit breaker settings.
     */
    CircuitBreakerConfig circuitBreaker();

    /**
     * Outbound HTTP settings.
     */
    interface HttpConfig {

        /**
         * Maximum time to wait for a single mirror to answer.
         *
         * <p>If exceeded, the attempt fails with a retryable timeout and the
         * next mirror is tried.
         *
         * @return Request timeout duration (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration requestTimeout();

        /**
         * User-Agent header sent with every upstream request.
         *
         * @return User agent string
         */
        @WithDefault("wikigate/1.0 (resilient Wikipedia access core)")
        String userAgent();
    }

    /**
     * Retry settings. A pass over all mirrors is tried at most {@code maxRetries + 1} times.
     */
    interface RetryConfig {

        /**
         * @return Retries after the first pass (default: 3)
         */
        @WithDefault("3")
        int maxRetries();

        /**
         * @return Wait before the first retry (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration baseDelay();

        /**
         * @return Upper bound for any wait (default: 8 seconds)
         */
        @WithDefault("PT8S")
        Duration maxDelay();

        /**
         * @return Growth factor between waits (default: 2)
         */
        @WithDefault("2.0")
        double backoffMultiplier();
    }

    /**
     * Per-mirror circuit breaker settings.
     */
    interface CircuitBreakerConfig {

        /**
         * Consecutive failures that open a mirror's circuit.
         *
         * @return Failure threshold (default: 3)
         */
        @WithDefault("3")
        int failureThreshold();

        /**
         * Time an open circuit waits before admitting a probe.
         *
         * @return Reset timeout (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration resetTimeout();
    }
}
