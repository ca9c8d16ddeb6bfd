package wikigate.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import wikigate.core.model.common.HealthStatus;
import wikigate.core.port.in.ContentUseCase;
import wikigate.core.service.telemetry.MonitoringService;

/**
 * Readiness check for the upstream mirrors.
 *
 * <p>Reports the circuit state of every mirror, the cache size, the number of
 * deduplicated requests in flight and the overall status, which combines
 * breaker health with the recent error rate.
 *
 * <p>Only an unhealthy overall status marks the check DOWN. A degraded
 * status still serves traffic through the remaining mirrors.
 */
@Readiness
@ApplicationScoped
public class UpstreamHealthCheck implements HealthCheck {

    static final String NAME = "upstream-mirrors";

    private final ContentUseCase content;
    private final MonitoringService monitoring;

    @Inject
    public UpstreamHealthCheck(ContentUseCase content, MonitoringService monitoring) {
        this.content = content;
        this.monitoring = monitoring;
    }

    @Override
    public HealthCheckResponse call() {
        final var health = content.healthCheck();
        final var overall = monitoring.overallStatus(health);

        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name(NAME);
        builder.withData("status", overall.label());
        builder.withData("upstream.status", health.status().label());
        builder.withData("cache.size", health.cacheSize());
        builder.withData("requests.pending", health.pendingRequests());
        health.endpoints().forEach((group, endpoints) -> endpoints.forEach(endpoint -> builder.withData(
                "circuit." + group + "." + endpoint.endpoint(), endpoint.status().state().name())));

        return overall == HealthStatus.UNHEALTHY ? builder.down().build() : builder.up().build();
    }
}
