package wikigate.core.model.telemetry;

import java.time.Instant;
import java.util.Map;

/**
 * One recorded metric sample.
 */
public record MetricEvent(String name, double value, Map<String, String> tags, Instant timestamp) {

    public MetricEvent {
        tags = Map.copyOf(tags);
    }
}
