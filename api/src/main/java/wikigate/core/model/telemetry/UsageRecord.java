package wikigate.core.model.telemetry;

import java.time.Instant;
import java.util.Map;

/**
 * One logical request as seen by usage analytics.
 *
 * @param method     logical method name, e.g. {@code wikipedia.search}
 * @param params     caller parameters
 * @param requestId  correlation id
 * @param durationMs wall-clock duration
 * @param success    whether the handler succeeded
 * @param errorType  error kind label when failed, otherwise {@code null}
 * @param userAgent  caller user agent, may be {@code null}
 * @param language   content language, may be {@code null}
 * @param timestamp  when the record was stored; set by the analytics store
 */
public record UsageRecord(
        String method,
        Map<String, Object> params,
        String requestId,
        long durationMs,
        boolean success,
        String errorType,
        String userAgent,
        String language,
        Instant timestamp) {

    public UsageRecord withTimestamp(Instant stamp) {
        return new UsageRecord(method, params, requestId, durationMs, success, errorType, userAgent, language, stamp);
    }
}
