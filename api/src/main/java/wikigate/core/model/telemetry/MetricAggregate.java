package wikigate.core.model.telemetry;

import java.util.Map;

/**
 * Count/sum/min/max/avg of the samples of one metric name within a window.
 *
 * @param tags tags of the first sample seen for the name
 */
public record MetricAggregate(long count, double sum, double min, double max, double avg, Map<String, String> tags) {

    /**
     * Returns a new aggregate that also includes {@code value}.
     */
    public MetricAggregate add(double value) {
        final var newCount = count + 1;
        final var newSum = sum + value;
        return new MetricAggregate(
                newCount, newSum, Math.min(min, value), Math.max(max, value), newSum / newCount, tags);
    }

    /**
     * Creates an aggregate holding a single sample.
     */
    public static MetricAggregate of(double value, Map<String, String> tags) {
        return new MetricAggregate(1, value, value, value, value, tags);
    }
}
