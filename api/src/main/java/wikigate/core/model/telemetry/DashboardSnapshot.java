package wikigate.core.model.telemetry;

import java.util.List;
import java.util.Map;

/**
 * Everything a health or metrics endpoint needs in one value.
 */
public record DashboardSnapshot(
        HealthMetrics health,
        Map<String, MetricAggregate> metrics,
        UsageStats usage,
        List<LogEvent> recentErrors) {}
