package wikigate.core.service;

import wikigate.core.cache.LocalCache;
import wikigate.core.service.resilience.EndpointRegistry;
import wikigate.core.service.resilience.RequestDeduplicator;
import wikigate.core.service.telemetry.MonitoringService;

/**
 * Process-wide resources shared by every content operation.
 *
 * <p>Built once at startup and passed by reference. Tests build their own
 * isolated instances.
 *
 * @param cache            decoded results keyed by request fingerprint
 * @param deduplicator     in-flight request coalescing
 * @param endpointRegistry endpoint managers per language
 * @param monitoring       telemetry cluster
 */
public record ServiceContext(
        LocalCache<String, Object> cache,
        RequestDeduplicator deduplicator,
        EndpointRegistry endpointRegistry,
        MonitoringService monitoring) {}
