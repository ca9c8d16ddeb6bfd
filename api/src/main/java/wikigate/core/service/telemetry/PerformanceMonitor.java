package wikigate.core.service.telemetry;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.smallrye.mutiny.Uni;

import wikigate.core.model.common.WikiAccessException;

/**
 * Times operations and records their duration and outcome.
 *
 * <p>Timers that are started but never ended expire after
 * {@link #ABANDONED_TIMER_TTL} so the map cannot grow without bound.
 */
public class PerformanceMonitor {

    static final Duration ABANDONED_TIMER_TTL = Duration.ofMinutes(10);

    private final MetricsCollector metrics;
    private final EventLogger logger;
    private final Clock clock;
    private final Cache<String, RunningTimer> timers;

    public PerformanceMonitor(MetricsCollector metrics, EventLogger logger, Clock clock) {
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
        this.timers = Caffeine.newBuilder()
                .expireAfterWrite(ABANDONED_TIMER_TTL)
                .build();
    }

    /**
     * Starts a timer for {@code operation}.
     *
     * @return the timer id to pass to {@link #endTimer}
     */
    public String startTimer(String operation, String requestId) {
        final var timerId = operation + "_" + UUID.randomUUID();
        timers.put(timerId, new RunningTimer(operation, requestId, clock.millis()));
        logger.debug("Timer started", Map.of("operation", operation, "timerId", timerId), requestId);
        return timerId;
    }

    /**
     * Stops a timer and records {@code operation_duration}.
     *
     * @return the elapsed milliseconds, or 0 if the timer is unknown
     */
    public long endTimer(String timerId, Map<String, String> tags) {
        final var timer = timers.asMap().remove(timerId);
        if (timer == null) {
            logger.warn("Timer not found", Map.of("timerId", timerId), null);
            return 0;
        }

        final var durationMs = clock.millis() - timer.startMillis();
        final var durationTags = new HashMap<>(tags);
        durationTags.put("operation", timer.operation());
        metrics.timing("operation_duration", durationMs, durationTags);
        logger.debug(
                "Timer ended",
                Map.of("operation", timer.operation(), "duration", durationMs),
                timer.requestId());
        return durationMs;
    }

    /**
     * Runs {@code operation} under a timer, recording {@code operation_success},
     * {@code operation_error} or {@code operation_cancelled}. Failures are always propagated.
     */
    public <T> Uni<T> monitorAsync(
            String operation, Supplier<Uni<T>> action, Map<String, String> tags, String requestId) {
        return Uni.createFrom().deferred(() -> {
            final var timerId = startTimer(operation, requestId);
            return Uni.createFrom()
                    .deferred(action::get)
                    .onItem()
                    .invoke(item -> {
                        endTimer(timerId, withStatus(tags, "success"));
                        metrics.increment("operation_success", withOperation(tags, operation));
                    })
                    .onFailure()
                    .invoke(error -> {
                        endTimer(timerId, withStatus(tags, "error"));
                        final var errorTags = withOperation(tags, operation);
                        errorTags.put("error", errorLabel(error));
                        metrics.increment("operation_error", errorTags);
                        final var context = new HashMap<String, Object>();
                        context.put("operation", operation);
                        context.put("error", String.valueOf(error.getMessage()));
                        context.put("tags", tags);
                        logger.error("Operation failed", context, requestId);
                    })
                    .onCancellation()
                    .invoke(() -> {
                        endTimer(timerId, withStatus(tags, "cancelled"));
                        metrics.increment("operation_cancelled", withOperation(tags, operation));
                        logger.warn("Operation cancelled", Map.of("operation", operation), requestId);
                    });
        });
    }

    /**
     * Number of timers started but not yet ended.
     */
    public long activeTimers() {
        timers.cleanUp();
        return timers.estimatedSize();
    }

    static String errorLabel(Throwable error) {
        final var kind = WikiAccessException.kindOf(error);
        return kind != null ? kind.label() : error.getClass().getSimpleName();
    }

    private static Map<String, String> withStatus(Map<String, String> tags, String status) {
        final var merged = new HashMap<>(tags);
        merged.put("status", status);
        return merged;
    }

    private static Map<String, String> withOperation(Map<String, String> tags, String operation) {
        final var merged = new HashMap<>(tags);
        merged.put("operation", operation);
        return merged;
    }

    private record RunningTimer(String operation, String requestId, long startMillis) {}
}
