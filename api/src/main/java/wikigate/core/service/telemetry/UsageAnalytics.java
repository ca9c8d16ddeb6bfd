package wikigate.core.service.telemetry;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import wikigate.core.model.telemetry.ErrorCount;
import wikigate.core.model.telemetry.HealthMetrics;
import wikigate.core.model.telemetry.QueryCount;
import wikigate.core.model.telemetry.UsageRecord;
import wikigate.core.model.telemetry.UsageStats;
import wikigate.core.util.RingBuffer;

/**
 * Bounded log of handled requests with usage and health summaries.
 */
public class UsageAnalytics {

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    static final int POPULAR_QUERY_LIMIT = 10;
    static final int TOP_ERROR_LIMIT = 5;

    private final RingBuffer<UsageRecord> records;
    private final Clock clock;

    public UsageAnalytics(int capacity, Clock clock) {
        this.records = new RingBuffer<>(capacity);
        this.clock = clock;
    }

    /**
     * Stores {@code record}, stamped with the current time.
     */
    public void recordRequest(UsageRecord record) {
        records.add(record.withTimestamp(clock.instant()));
    }

    public UsageStats getUsageStats() {
        return getUsageStats(DEFAULT_WINDOW);
    }

    /**
     * Summarizes the requests of the trailing {@code window}.
     */
    public UsageStats getUsageStats(Duration window) {
        final var recent = since(window);
        final var total = recent.size();

        final var byMethod = countBy(recent, UsageRecord::method);
        final var byLanguage = countBy(recent, record -> record.language() == null ? "unknown" : record.language());

        final var popular = recent.stream()
                .filter(record -> record.method().contains("search"))
                .map(record -> record.params().get("query"))
                .filter(String.class::isInstance)
                .map(query -> ((String) query).toLowerCase(Locale.ROOT))
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()))
                .entrySet()
                .stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(POPULAR_QUERY_LIMIT)
                .map(entry -> new QueryCount(entry.getKey(), entry.getValue()))
                .toList();

        return new UsageStats(total, byMethod, byLanguage, errorRate(recent), avgDuration(recent), popular);
    }

    /**
     * Request rate over the last minute, error rate and mean duration over
     * the last hour, and the most frequent error kinds.
     */
    public HealthMetrics getHealthMetrics() {
        final var lastMinute = since(Duration.ofMinutes(1));
        final var lastHour = since(Duration.ofHours(1));

        final var topErrors = lastHour.stream()
                .filter(record -> !record.success() && record.errorType() != null)
                .collect(Collectors.groupingBy(UsageRecord::errorType, LinkedHashMap::new, Collectors.counting()))
                .entrySet()
                .stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_ERROR_LIMIT)
                .map(entry -> new ErrorCount(entry.getKey(), entry.getValue()))
                .toList();

        return new HealthMetrics(lastMinute.size(), errorRate(lastHour), avgDuration(lastHour), topErrors);
    }

    public int size() {
        return records.size();
    }

    private List<UsageRecord> since(Duration window) {
        final var cutoff = clock.instant().minus(window);
        return records.snapshot(record -> !record.timestamp().isBefore(cutoff));
    }

    private static Map<String, Long> countBy(List<UsageRecord> records, Function<UsageRecord, String> key) {
        return records.stream().collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.counting()));
    }

    private static double errorRate(List<UsageRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        final var failures = records.stream().filter(record -> !record.success()).count();
        return (double) failures / records.size();
    }

    private static double avgDuration(List<UsageRecord> records) {
        return records.stream().mapToLong(UsageRecord::durationMs).average().orElse(0);
    }
}
