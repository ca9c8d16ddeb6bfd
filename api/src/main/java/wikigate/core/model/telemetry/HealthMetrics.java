package wikigate.core.model.telemetry;

import java.util.List;

/**
 * Request health over fixed windows.
 *
 * @param requestRate     requests in the last minute
 * @param errorRate       failed share of requests in the last hour
 * @param avgResponseTime mean duration in the last hour, in milliseconds
 * @param topErrors       most frequent error kinds in the last hour
 */
public record HealthMetrics(int requestRate, double errorRate, double avgResponseTime, List<ErrorCount> topErrors) {}
