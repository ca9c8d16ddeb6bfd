package wikigate.core.service.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wikigate.core.model.telemetry.ErrorCount;
import wikigate.core.model.telemetry.QueryCount;
import wikigate.core.model.telemetry.UsageRecord;
import wikigate.support.MutableClock;

@DisplayName("UsageAnalytics")
class UsageAnalyticsTest {

    private MutableClock clock;
    private UsageAnalytics analytics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        analytics = new UsageAnalytics(100, clock);
    }

    private void record(String method, Map<String, Object> params, long duration, String errorType, String lang) {
        analytics.recordRequest(
                new UsageRecord(method, params, null, duration, errorType == null, errorType, null, lang, null));
    }

    @Nested
    @DisplayName("Usage stats")
    class Stats {

        @Test
        @DisplayName("should report zeros without traffic")
        void shouldReportZeros() {
            var stats = analytics.getUsageStats();

            assertEquals(0, stats.total());
            assertEquals(0.0, stats.errorRate());
            assertEquals(0.0, stats.avgDuration());
        }

        @Test
        @DisplayName("should count by method and language")
        void shouldCountByMethodAndLanguage() {
            record("search", Map.of("query", "Cat"), 100, null, "en");
            record("search", Map.of("query", "dog"), 300, "timeout", "de");
            record("getPage", Map.of("title", "Cat"), 200, null, "en");

            var stats = analytics.getUsageStats();

            assertEquals(3, stats.total());
            assertEquals(Map.of("search", 2L, "getPage", 1L), stats.byMethod());
            assertEquals(Map.of("en", 2L, "de", 1L), stats.byLanguage());
            assertEquals(1.0 / 3, stats.errorRate(), 1e-9);
            assertEquals(200.0, stats.avgDuration(), 1e-9);
        }

        @Test
        @DisplayName("should rank lower-cased search queries")
        void shouldRankPopularQueries() {
            record("search", Map.of("query", "Cat"), 1, null, "en");
            record("search", Map.of("query", "cat"), 1, null, "en");
            record("fullTextSearch", Map.of("query", "dog"), 1, null, "en");
            record("getPage", Map.of("query", "ignored"), 1, null, "en");

            var popular = analytics.getUsageStats().popularQueries();

            assertEquals(List.of(new QueryCount("cat", 2), new QueryCount("dog", 1)), popular);
        }

        @Test
        @DisplayName("should only include requests inside the window")
        void shouldRespectWindow() {
            record("search", Map.of(), 1, null, "en");
            clock.advance(Duration.ofMinutes(61));
            record("search", Map.of(), 1, null, "en");

            assertEquals(1, analytics.getUsageStats().total());
            assertEquals(2, analytics.getUsageStats(Duration.ofHours(2)).total());
        }
    }

    @Nested
    @DisplayName("Health metrics")
    class Health {

        @Test
        @DisplayName("should report last-minute rate and top errors")
        void shouldReportHealth() {
            record("search", Map.of(), 100, "timeout", "en");
            clock.advance(Duration.ofMinutes(5));
            record("search", Map.of(), 200, "timeout", "en");
            record("search", Map.of(), 300, "circuit_open", "en");
            record("search", Map.of(), 400, null, "en");

            var health = analytics.getHealthMetrics();

            assertEquals(3, health.requestRate());
            assertEquals(0.75, health.errorRate(), 1e-9);
            assertEquals(250.0, health.avgResponseTime(), 1e-9);
            assertEquals(List.of(new ErrorCount("timeout", 2), new ErrorCount("circuit_open", 1)), health.topErrors());
        }
    }
}
