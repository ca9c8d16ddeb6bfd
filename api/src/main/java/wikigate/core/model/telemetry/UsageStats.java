package wikigate.core.model.telemetry;

import java.util.List;
import java.util.Map;

/**
 * Usage breakdown over a trailing window.
 *
 * @param total          requests in the window
 * @param byMethod       request count per method
 * @param byLanguage     request count per content language
 * @param errorRate      failed / total, 0 when empty
 * @param avgDuration    mean duration in milliseconds, 0 when empty
 * @param popularQueries most frequent search queries, most popular first
 */
public record UsageStats(
        int total,
        Map<String, Long> byMethod,
        Map<String, Long> byLanguage,
        double errorRate,
        double avgDuration,
        List<QueryCount> popularQueries) {}
