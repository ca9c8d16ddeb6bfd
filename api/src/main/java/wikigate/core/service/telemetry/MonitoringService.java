package wikigate.core.service.telemetry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

import wikigate.core.model.common.HealthStatus;
import wikigate.core.model.content.ContentHealth;
import wikigate.core.model.telemetry.DashboardSnapshot;
import wikigate.core.model.telemetry.LogLevel;
import wikigate.core.model.telemetry.UsageRecord;

/**
 * Entry point of the telemetry cluster.
 *
 * <p>Wraps request handlers so that each one is timed, counted and recorded
 * in the usage log, and assembles the dashboard snapshot.
 */
public class MonitoringService {

    static final String DEFAULT_LANGUAGE = "en";
    static final String CANCELLED = "cancelled";
    static final double HEALTHY_ERROR_RATE = 0.1;
    static final double UNHEALTHY_ERROR_RATE = 0.5;

    private final MetricsCollector metrics;
    private final EventLogger logger;
    private final PerformanceMonitor performance;
    private final UsageAnalytics analytics;
    private final Clock clock;

    public MonitoringService(
            MetricsCollector metrics,
            EventLogger logger,
            PerformanceMonitor performance,
            UsageAnalytics analytics,
            Clock clock) {
        this.metrics = metrics;
        this.logger = logger;
        this.performance = performance;
        this.analytics = analytics;
        this.clock = clock;
    }

    public <T> Uni<T> monitorRequest(
            String method, Map<String, Object> params, String requestId, Supplier<Uni<T>> handler) {
        return monitorRequest(method, params, requestId, null, handler);
    }

    /**
     * Runs {@code handler} as the request {@code method}, recording its
     * duration, outcome and usage. The handler's outcome is returned unchanged.
     * A cancelled request is recorded as unsuccessful with error type {@code cancelled}.
     *
     * @param method    logical operation name, e.g. {@code search}
     * @param params    request parameters; {@code lang} and {@code query} are analyzed
     * @param requestId correlation id for logs
     * @param userAgent caller's user agent, may be null
     * @param handler   the request handler
     */
    public <T> Uni<T> monitorRequest(
            String method,
            Map<String, Object> params,
            String requestId,
            String userAgent,
            Supplier<Uni<T>> handler) {
        final var language = params.get("lang") instanceof String lang ? lang : DEFAULT_LANGUAGE;
        final var tags = Map.of("method", method, "language", language);

        return Uni.createFrom().deferred(() -> {
            final var started = clock.millis();
            return performance
                    .monitorAsync("rpc_" + method, handler, tags, requestId)
                    .onItem()
                    .invoke(item -> analytics.recordRequest(new UsageRecord(
                            method, params, requestId, clock.millis() - started, true, null, userAgent, language,
                            null)))
                    .onFailure()
                    .invoke(error -> analytics.recordRequest(new UsageRecord(
                            method,
                            params,
                            requestId,
                            clock.millis() - started,
                            false,
                            PerformanceMonitor.errorLabel(error),
                            userAgent,
                            language,
                            null)))
                    .onCancellation()
                    .invoke(() -> analytics.recordRequest(new UsageRecord(
                            method,
                            params,
                            requestId,
                            clock.millis() - started,
                            false,
                            CANCELLED,
                            userAgent,
                            language,
                            null)));
        });
    }

    /**
     * Health summary, five-minute metric aggregates, hourly usage and the
     * error logs of the last hour.
     */
    public DashboardSnapshot getDashboardData() {
        final var recentErrors = logger.getLogs(LogLevel.ERROR, clock.instant().minus(Duration.ofHours(1)));
        return new DashboardSnapshot(
                analytics.getHealthMetrics(),
                metrics.getAggregatedMetrics(),
                analytics.getUsageStats(),
                recentErrors);
    }

    /**
     * Combines upstream health with the observed error rate.
     */
    public HealthStatus overallStatus(ContentHealth upstream) {
        final var errorRate = analytics.getHealthMetrics().errorRate();
        if (upstream.status() == HealthStatus.UNHEALTHY || errorRate > UNHEALTHY_ERROR_RATE) {
            return HealthStatus.UNHEALTHY;
        }
        if (upstream.status() == HealthStatus.HEALTHY && errorRate < HEALTHY_ERROR_RATE) {
            return HealthStatus.HEALTHY;
        }
        return HealthStatus.DEGRADED;
    }

    public MetricsCollector metrics() {
        return metrics;
    }

    public EventLogger logger() {
        return logger;
    }

    public PerformanceMonitor performance() {
        return performance;
    }

    public UsageAnalytics analytics() {
        return analytics;
    }
}
