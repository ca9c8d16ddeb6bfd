package wikigate.core.model.common;

/**
 * Coarse health classification reported to callers and the readiness probe.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public String label() {
        return name().toLowerCase();
    }
}
