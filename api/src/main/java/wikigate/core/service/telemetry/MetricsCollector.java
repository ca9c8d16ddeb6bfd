package wikigate.core.service.telemetry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import wikigate.core.model.telemetry.MetricAggregate;
import wikigate.core.model.telemetry.MetricEvent;
import wikigate.core.port.out.MetricsExporter;
import wikigate.core.util.RingBuffer;

/**
 * Bounded in-memory recorder of metric samples with windowed aggregation.
 *
 * <p>Every sample is also handed to the {@link MetricsExporter}, which
 * publishes it to the external metrics system when enabled.
 */
public class MetricsCollector {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);

    private final RingBuffer<MetricEvent> events;
    private final MetricsExporter exporter;
    private final Clock clock;

    public MetricsCollector(int capacity, MetricsExporter exporter, Clock clock) {
        this.events = new RingBuffer<>(capacity);
        this.exporter = exporter;
        this.clock = clock;
    }

    /**
     * Records a raw sample. Exported as a distribution of values.
     */
    public void record(String name, double value, Map<String, String> tags) {
        append(name, value, tags);
        if (exporter.isEnabled()) {
            exporter.sample(name, value, tags);
        }
    }

    /**
     * Records a counter increment of one.
     */
    public void increment(String name, Map<String, String> tags) {
        append(name, 1, tags);
        if (exporter.isEnabled()) {
            exporter.count(name, 1, tags);
        }
    }

    /**
     * Records a duration in milliseconds, tagged {@code unit=ms}.
     */
    public void timing(String name, long durationMs, Map<String, String> tags) {
        append(name, durationMs, withTag(tags, "unit", "ms"));
        if (exporter.isEnabled()) {
            exporter.timing(name, durationMs, tags);
        }
    }

    /**
     * Records a point-in-time value, tagged {@code type=gauge}.
     */
    public void gauge(String name, double value, Map<String, String> tags) {
        append(name, value, withTag(tags, "type", "gauge"));
        if (exporter.isEnabled()) {
            exporter.gauge(name, value, tags);
        }
    }

    /**
     * Returns the recorded samples at or after {@code since}, or all samples if {@code since} is null.
     */
    public List<MetricEvent> getMetrics(Instant since) {
        if (since == null) {
            return events.snapshot();
        }
        return events.snapshot(event -> !event.timestamp().isBefore(since));
    }

    /**
     * Aggregates the samples of the default five-minute window by metric name.
     */
    public Map<String, MetricAggregate> getAggregatedMetrics() {
        return getAggregatedMetrics(DEFAULT_WINDOW);
    }

    /**
     * Aggregates the samples of the trailing {@code window} by metric name.
     */
    public Map<String, MetricAggregate> getAggregatedMetrics(Duration window) {
        final var aggregated = new LinkedHashMap<String, MetricAggregate>();
        for (var event : getMetrics(clock.instant().minus(window))) {
            aggregated.merge(
                    event.name(),
                    MetricAggregate.of(event.value(), event.tags()),
                    (existing, fresh) -> existing.add(event.value()));
        }
        return aggregated;
    }

    public int size() {
        return events.size();
    }

    private void append(String name, double value, Map<String, String> tags) {
        events.add(new MetricEvent(name, value, tags, clock.instant()));
    }

    private static Map<String, String> withTag(Map<String, String> tags, String key, String value) {
        final var merged = new HashMap<>(tags);
        merged.put(key, value);
        return merged;
    }
}
