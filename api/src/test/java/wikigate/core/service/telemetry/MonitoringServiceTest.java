package wikigate.core.service.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wikigate.core.model.common.CircuitOpenException;
import wikigate.core.model.common.HealthStatus;
import wikigate.core.model.content.ContentHealth;
import wikigate.core.port.out.MetricsExporter;
import wikigate.support.MutableClock;

@DisplayName("MonitoringService")
class MonitoringServiceTest {

    private MonitoringService monitoring;

    @BeforeEach
    void setUp() {
        var clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        var metrics = new MetricsCollector(100, mock(MetricsExporter.class), clock);
        var logger = new EventLogger(100, clock);
        monitoring = new MonitoringService(
                metrics, logger, new PerformanceMonitor(metrics, logger, clock), new UsageAnalytics(100, clock), clock);
    }

    private void succeed(int times) {
        for (int i = 0; i < times; i++) {
            monitoring.monitorRequest("search", Map.of("query", "cat"), "req", () -> Uni.createFrom().item("ok"))
                    .await()
                    .indefinitely();
        }
    }

    private void failWith(RuntimeException error, int times) {
        for (int i = 0; i < times; i++) {
            assertThrows(
                    error.getClass(),
                    () -> monitoring.monitorRequest(
                                    "search",
                                    Map.of("lang", "de"),
                                    "req",
                                    () -> Uni.createFrom().<String>failure(error))
                            .await()
                            .indefinitely());
        }
    }

    private static ContentHealth upstream(HealthStatus status) {
        return new ContentHealth(status, Map.of(), 0, 0);
    }

    @Nested
    @DisplayName("monitorRequest")
    class MonitorRequest {

        @Test
        @DisplayName("should record a successful request with the default language")
        void shouldRecordSuccess() {
            succeed(1);

            var usage = monitoring.getDashboardData().usage();
            assertEquals(1, usage.total());
            assertEquals(Map.of("en", 1L), usage.byLanguage());
            var success = monitoring.metrics().getAggregatedMetrics().get("operation_success");
            assertEquals("rpc_search", success.tags().get("operation"));
            assertEquals("search", success.tags().get("method"));
        }

        @Test
        @DisplayName("should record the error kind and rethrow")
        void shouldRecordErrorKind() {
            failWith(new CircuitOpenException("https://de.wikipedia.org"), 1);

            var health = monitoring.getDashboardData().health();
            assertEquals(1.0, health.errorRate());
            assertEquals("circuit_open", health.topErrors().get(0).error());
            assertEquals(Map.of("de", 1L), monitoring.getDashboardData().usage().byLanguage());
        }

        @Test
        @DisplayName("should use the class name for untyped errors")
        void shouldUseClassNameForUntypedErrors() {
            failWith(new IllegalStateException("bug"), 1);

            assertEquals(
                    "IllegalStateException",
                    monitoring.getDashboardData().health().topErrors().get(0).error());
        }

        @Test
        @DisplayName("should record a cancelled request as unsuccessful")
        void shouldRecordCancellation() {
            monitoring
                    .monitorRequest("search", Map.of("lang", "fr"), "req", () -> Uni.createFrom().<String>nothing())
                    .subscribe()
                    .with(item -> {})
                    .cancel();

            var health = monitoring.getDashboardData().health();
            assertEquals(1.0, health.errorRate());
            assertEquals("cancelled", health.topErrors().get(0).error());
            assertEquals(Map.of("fr", 1L), monitoring.getDashboardData().usage().byLanguage());
            assertEquals(0, monitoring.performance().activeTimers());
        }
    }

    @Nested
    @DisplayName("Dashboard")
    class Dashboard {

        @Test
        @DisplayName("should include recent error logs")
        void shouldIncludeRecentErrors() {
            succeed(2);
            failWith(new IllegalStateException("bug"), 1);

            var dashboard = monitoring.getDashboardData();

            assertEquals(1, dashboard.recentErrors().size());
            assertTrue(dashboard.metrics().containsKey("operation_duration"));
            assertEquals(3, dashboard.usage().total());
            assertEquals(List.of("cat"), dashboard.usage().popularQueries().stream().map(q -> q.query()).toList());
        }

        @Test
        @DisplayName("should start empty")
        void shouldStartEmpty() {
            var dashboard = monitoring.getDashboardData();

            assertTrue(dashboard.recentErrors().isEmpty());
            assertFalse(dashboard.metrics().containsKey("operation_error"));
            assertNull(dashboard.metrics().get("operation_success"));
        }
    }

    @Nested
    @DisplayName("overallStatus")
    class OverallStatus {

        @Test
        @DisplayName("should be healthy with healthy upstream and no errors")
        void shouldBeHealthy() {
            succeed(10);

            assertEquals(HealthStatus.HEALTHY, monitoring.overallStatus(upstream(HealthStatus.HEALTHY)));
        }

        @Test
        @DisplayName("should be degraded with a degraded upstream")
        void shouldBeDegradedWithDegradedUpstream() {
            assertEquals(HealthStatus.DEGRADED, monitoring.overallStatus(upstream(HealthStatus.DEGRADED)));
        }

        @Test
        @DisplayName("should be degraded with a moderate error rate")
        void shouldBeDegradedWithModerateErrors() {
            succeed(7);
            failWith(new IllegalStateException("bug"), 3);

            assertEquals(HealthStatus.DEGRADED, monitoring.overallStatus(upstream(HealthStatus.HEALTHY)));
        }

        @Test
        @DisplayName("should be unhealthy with an error rate above one half")
        void shouldBeUnhealthyWithHighErrors() {
            succeed(1);
            failWith(new IllegalStateException("bug"), 2);

            assertEquals(HealthStatus.UNHEALTHY, monitoring.overallStatus(upstream(HealthStatus.HEALTHY)));
        }

        @Test
        @DisplayName("should be unhealthy when the upstream is unhealthy")
        void shouldBeUnhealthyWithUnhealthyUpstream() {
            assertEquals(HealthStatus.UNHEALTHY, monitoring.overallStatus(upstream(HealthStatus.UNHEALTHY)));
        }
    }
}
