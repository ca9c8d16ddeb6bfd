package wikigate.adapter.out.telemetry;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import wikigate.config.TelemetryConfig;
import wikigate.core.port.out.MetricsExporter;

/**
 * Publishes recorded metric events to Micrometer.
 *
 * <p>All methods are no-ops when metric export is disabled. Metric names are
 * prefixed with {@code wikigate.}; tags are passed through unchanged.
 */
@ApplicationScoped
public class MicrometerMetricsExporter implements MetricsExporter {

    static final String PREFIX = "wikigate.";

    private final MeterRegistry registry;
    private final boolean enabled;

    // Gauges sample these holders; keyed by name and sorted tags
    private final Map<String, AtomicReference<Double>> gauges = new ConcurrentHashMap<>();

    @Inject
    public MicrometerMetricsExporter(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void count(String name, double amount, Map<String, String> tags) {
        if (!enabled) {
            return;
        }

        Counter.builder(PREFIX + name).tags(toTags(tags)).register(registry).increment(amount);
    }

    @Override
    public void timing(String name, long durationMs, Map<String, String> tags) {
        if (!enabled) {
            return;
        }

        Timer.builder(PREFIX + name)
                .tags(toTags(tags))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void sample(String name, double value, Map<String, String> tags) {
        if (!enabled) {
            return;
        }

        DistributionSummary.builder(PREFIX + name)
                .tags(toTags(tags))
                .register(registry)
                .record(value);
    }

    @Override
    public void gauge(String name, double value, Map<String, String> tags) {
        if (!enabled) {
            return;
        }

        final var sorted = new TreeMap<>(tags);
        final var holder = gauges.computeIfAbsent(name + sorted, key -> {
            final var state = new AtomicReference<>(value);
            Gauge.builder(PREFIX + name, state, AtomicReference::get)
                    .tags(toTags(sorted))
                    .register(registry);
            return state;
        });
        holder.set(value);
    }

    private static Tags toTags(Map<String, String> tags) {
        var result = Tags.empty();
        for (var entry : tags.entrySet()) {
            result = result.and(entry.getKey(), entry.getValue() == null ? "unknown" : entry.getValue());
        }
        return result;
    }
}
