package wikigate.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wikigate.config.TelemetryConfig;

@DisplayName("MicrometerMetricsExporter")
class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private TelemetryConfig telemetryConfig;
    private TelemetryConfig.MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        telemetryConfig = mock(TelemetryConfig.class);
        metricsConfig = mock(TelemetryConfig.MetricsConfig.class);
        when(telemetryConfig.metrics()).thenReturn(metricsConfig);
    }

    private MicrometerMetricsExporter exporter(boolean enabled) {
        when(metricsConfig.enabled()).thenReturn(enabled);
        return new MicrometerMetricsExporter(registry, telemetryConfig);
    }

    @Nested
    @DisplayName("When enabled")
    class Enabled {

        @Test
        @DisplayName("should accumulate counters per tag set")
        void shouldAccumulateCounters() {
            var exporter = exporter(true);

            exporter.count("cache_hit", 1, Map.of("operation", "search"));
            exporter.count("cache_hit", 2, Map.of("operation", "search"));
            exporter.count("cache_hit", 1, Map.of("operation", "page"));

            assertTrue(exporter.isEnabled());
            assertEquals(
                    3.0,
                    registry.get("wikigate.cache_hit").tag("operation", "search").counter().count());
            assertEquals(
                    1.0,
                    registry.get("wikigate.cache_hit").tag("operation", "page").counter().count());
        }

        @Test
        @DisplayName("should record timings in milliseconds")
        void shouldRecordTimings() {
            var exporter = exporter(true);

            exporter.timing("operation_duration", 120, Map.of("operation", "rpc_search"));
            exporter.timing("operation_duration", 80, Map.of("operation", "rpc_search"));

            var timer = registry.get("wikigate.operation_duration").tag("operation", "rpc_search").timer();
            assertEquals(2, timer.count());
            assertEquals(200.0, timer.totalTime(TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("should record raw samples in a distribution summary")
        void shouldRecordSamples() {
            var exporter = exporter(true);

            exporter.sample("response_bytes", 100, Map.of("operation", "page"));
            exporter.sample("response_bytes", 300, Map.of("operation", "page"));

            var summary = registry.get("wikigate.response_bytes").tag("operation", "page").summary();
            assertEquals(2, summary.count());
            assertEquals(400.0, summary.totalAmount());
            assertEquals(300.0, summary.max());
        }

        @Test
        @DisplayName("should report the latest gauge value")
        void shouldUpdateGauges() {
            var exporter = exporter(true);

            exporter.gauge("cache_size", 10, Map.of());
            exporter.gauge("cache_size", 42, Map.of());

            assertEquals(42.0, registry.get("wikigate.cache_size").gauge().value());
            assertEquals(1, registry.find("wikigate.cache_size").gauges().size());
        }

        @Test
        @DisplayName("should replace null tag values")
        void shouldReplaceNullTags() {
            var exporter = exporter(true);
            var tags = new HashMap<String, String>();
            tags.put("language", null);

            exporter.count("requests", 1, tags);

            assertNotNull(registry.find("wikigate.requests").tag("language", "unknown").counter());
        }
    }

    @Nested
    @DisplayName("When disabled")
    class Disabled {

        @Test
        @DisplayName("should register no meters")
        void shouldRegisterNothing() {
            var exporter = exporter(false);

            exporter.count("cache_hit", 1, Map.of());
            exporter.timing("operation_duration", 5, Map.of());
            exporter.gauge("cache_size", 1, Map.of());
            exporter.sample("response_bytes", 1, Map.of());

            assertFalse(exporter.isEnabled());
            assertTrue(registry.getMeters().isEmpty());
        }
    }
}
