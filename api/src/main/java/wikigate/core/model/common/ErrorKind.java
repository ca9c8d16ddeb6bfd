package wikigate.core.model.common;

/**
 * Structural tag attached to every failure raised by the access core.
 *
 * <p>Retry and failover decisions are made on this tag, never on the
 * runtime class name of an exception.
 */
public enum ErrorKind {
    VALIDATION,
    UPSTREAM_HTTP,
    NETWORK,
    TIMEOUT,
    CIRCUIT_OPEN,
    ALL_ENDPOINTS_FAILED,
    DECODING;

    /**
     * Returns the lower-case label used in metric tags and analytics.
     */
    public String label() {
        return name().toLowerCase();
    }
}
