package wikigate.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the in-memory telemetry buffers and metric export.
 *
 * <p>Example configuration:
 * <pre>{@code
 * wikigate.telemetry.metrics.enabled=true
 * wikigate.telemetry.buffers.metrics=1000
 * }</pre>
 */
@ConfigMapping(prefix = "wikigate.telemetry")
public interface TelemetryConfig {

    /**
     * Metric export configuration.
     */
    MetricsConfig metrics();

    /**
     * Ring buffer capacities.
     */
    BuffersConfig buffers();

    /**
     * Metric export configuration.
     */
    interface MetricsConfig {
        /**
         * Publish recorded metrics to the Micrometer registry.
         */
        @WithDefault("false")
        boolean enabled();
    }

    /**
     * Ring buffer capacities. The oldest entry is dropped when a buffer is full.
     */
    interface BuffersConfig {
        @WithDefault("1000")
        int metrics();

        @WithDefault("500")
        int logs();

        @WithDefault("2000")
        int usage();
    }
}
