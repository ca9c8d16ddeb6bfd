package wikigate.core.model.telemetry;

import java.time.Instant;
import java.util.Map;

/**
 * Structured log entry kept in the in-memory log buffer.
 *
 * @param requestId correlation id, or {@code null}
 */
public record LogEvent(
        LogLevel level, String message, Map<String, Object> context, Instant timestamp, String requestId) {}
