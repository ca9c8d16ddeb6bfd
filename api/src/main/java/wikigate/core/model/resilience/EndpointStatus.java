package wikigate.core.model.resilience;

/**
 * Breaker status of one mirror base URL.
 */
public record EndpointStatus(String endpoint, CircuitBreakerStatus status, boolean preferred) {}
