package wikigate.core.model.content;

import java.util.List;
import java.util.Map;

import wikigate.core.model.common.HealthStatus;
import wikigate.core.model.resilience.EndpointStatus;

/**
 * Health of the content-access layer.
 *
 * @param status          combined breaker health
 * @param endpoints       breaker status per endpoint group
 * @param cacheSize       entries currently cached
 * @param pendingRequests deduplicated requests in flight
 */
public record ContentHealth(
        HealthStatus status, Map<String, List<EndpointStatus>> endpoints, long cacheSize, int pendingRequests) {}
