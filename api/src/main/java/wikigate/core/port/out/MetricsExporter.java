package wikigate.core.port.out;

import java.util.Map;

/**
 * Port for publishing recorded metric events to an external metrics system.
 *
 * <p>Implementations handle the actual publishing (e.g., Micrometer).
 */
public interface MetricsExporter {

    /**
     * Check if exporting is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Publish a counter increment.
     */
    void count(String name, double amount, Map<String, String> tags);

    /**
     * Publish a duration in milliseconds.
     */
    void timing(String name, long durationMs, Map<String, String> tags);

    /**
     * Publish one observation of a value distribution.
     */
    void sample(String name, double value, Map<String, String> tags);

    /**
     * Publish the current value of a gauge.
     */
    void gauge(String name, double value, Map<String, String> tags);
}
