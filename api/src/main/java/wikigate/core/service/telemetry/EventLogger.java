package wikigate.core.service.telemetry;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import wikigate.core.model.telemetry.LogEvent;
import wikigate.core.model.telemetry.LogLevel;
import wikigate.core.util.RingBuffer;

/**
 * Leveled, structured log that keeps the most recent events in memory.
 *
 * <p>Every event is forwarded to JBoss Logging for immediate visibility and
 * also retained in a bounded buffer so the dashboard can show recent errors.
 */
public class EventLogger {

    private static final Logger LOG = Logger.getLogger(EventLogger.class);

    private final RingBuffer<LogEvent> events;
    private final Clock clock;

    public EventLogger(int capacity, Clock clock) {
        this.events = new RingBuffer<>(capacity);
        this.clock = clock;
    }

    public void debug(String message, Map<String, Object> context, String requestId) {
        log(LogLevel.DEBUG, message, context, requestId);
    }

    public void info(String message, Map<String, Object> context, String requestId) {
        log(LogLevel.INFO, message, context, requestId);
    }

    public void warn(String message, Map<String, Object> context, String requestId) {
        log(LogLevel.WARN, message, context, requestId);
    }

    public void error(String message, Map<String, Object> context, String requestId) {
        log(LogLevel.ERROR, message, context, requestId);
    }

    /**
     * Returns retained events, oldest first.
     *
     * @param level only events of this level, or all levels if null
     * @param since only events at or after this instant, or all if null
     */
    public List<LogEvent> getLogs(LogLevel level, Instant since) {
        return events.snapshot(event -> (level == null || event.level() == level)
                && (since == null || !event.timestamp().isBefore(since)));
    }

    public int size() {
        return events.size();
    }

    private void log(LogLevel level, String message, Map<String, Object> context, String requestId) {
        final var safeContext = context == null ? Map.<String, Object>of() : context;
        events.add(new LogEvent(level, message, safeContext, clock.instant(), requestId));

        final var jbossLevel = toJBossLevel(level);
        if (LOG.isEnabled(jbossLevel)) {
            if (requestId != null) {
                LOG.logf(jbossLevel, "[%s] %s %s", requestId, message, safeContext);
            } else {
                LOG.logf(jbossLevel, "%s %s", message, safeContext);
            }
        }
    }

    private static Logger.Level toJBossLevel(LogLevel level) {
        return switch (level) {
            case DEBUG -> Logger.Level.DEBUG;
            case INFO -> Logger.Level.INFO;
            case WARN -> Logger.Level.WARN;
            case ERROR -> Logger.Level.ERROR;
        };
    }
}
