package wikigate.core.model.common;

/**
 * Fast failure for a mirror whose circuit breaker rejects calls.
 */
public class CircuitOpenException extends WikiAccessException {

    private final String endpoint;

    public CircuitOpenException(String endpoint) {
        super(ErrorKind.CIRCUIT_OPEN, "Circuit breaker is OPEN for " + endpoint);
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
