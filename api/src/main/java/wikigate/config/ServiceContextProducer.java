package wikigate.config;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import wikigate.core.cache.LocalCache;
import wikigate.core.cache.LocalCacheConfig;
import wikigate.core.cache.TtlLruCache;
import wikigate.core.config.ResiliencyConfig;
import wikigate.core.config.UpstreamConfig;
import wikigate.core.model.common.WikiAccessException;
import wikigate.core.model.resilience.CircuitBreakerPolicy;
import wikigate.core.model.resilience.ResilienceSettings;
import wikigate.core.model.resilience.RetryPolicy;
import wikigate.core.port.in.ContentUseCase;
import wikigate.core.port.out.MetricsExporter;
import wikigate.core.port.out.UpstreamClient;
import wikigate.core.service.ServiceContext;
import wikigate.core.service.content.ContentService;
import wikigate.core.service.content.WikiResponseDecoder;
import wikigate.core.service.resilience.EndpointRegistry;
import wikigate.core.service.resilience.RequestDeduplicator;
import wikigate.core.service.resilience.RetryExecutor;
import wikigate.core.service.telemetry.EventLogger;
import wikigate.core.service.telemetry.MetricsCollector;
import wikigate.core.service.telemetry.MonitoringService;
import wikigate.core.service.telemetry.PerformanceMonitor;
import wikigate.core.service.telemetry.UsageAnalytics;

/**
 * Produces the process-wide core objects from configuration.
 *
 * <p>This bridges the configuration mappings to the plain core classes, which
 * carry no CDI annotations. Everything produced here lives for the whole
 * process and is shared by every request.
 */
@ApplicationScoped
public class ServiceContextProducer {

    private static final Logger LOG = Logger.getLogger(ServiceContextProducer.class);

    private final LocalCacheConfig cacheConfig;
    private final ResiliencyConfig resiliencyConfig;
    private final UpstreamConfig upstreamConfig;
    private final TelemetryConfig telemetryConfig;

    @Inject
    public ServiceContextProducer(
            LocalCacheConfig cacheConfig,
            ResiliencyConfig resiliencyConfig,
            UpstreamConfig upstreamConfig,
            TelemetryConfig telemetryConfig) {
        this.cacheConfig = cacheConfig;
        this.resiliencyConfig = resiliencyConfig;
        this.upstreamConfig = upstreamConfig;
        this.telemetryConfig = telemetryConfig;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public MonitoringService monitoringService(MetricsExporter exporter, Clock clock) {
        final var buffers = telemetryConfig.buffers();
        final var metrics = new MetricsCollector(buffers.metrics(), exporter, clock);
        final var logger = new EventLogger(buffers.logs(), clock);
        final var performance = new PerformanceMonitor(metrics, logger, clock);
        final var analytics = new UsageAnalytics(buffers.usage(), clock);
        return new MonitoringService(metrics, logger, performance, analytics, clock);
    }

    @Produces
    @Singleton
    public ServiceContext serviceContext(UpstreamClient client, MonitoringService monitoring, Clock clock) {
        final LocalCache<String, Object> cache = new TtlLruCache<>(cacheConfig.ttl(), cacheConfig.maxEntries(), clock);

        final var retry = resiliencyConfig.retry();
        final var breaker = resiliencyConfig.circuitBreaker();
        final var settings = new ResilienceSettings(
                new RetryPolicy(
                        retry.maxRetries(),
                        retry.baseDelay(),
                        retry.maxDelay(),
                        retry.backoffMultiplier(),
                        WikiAccessException::isRetryableFailure),
                new CircuitBreakerPolicy(breaker.failureThreshold(), breaker.resetTimeout()),
                resiliencyConfig.http().requestTimeout());

        final var registry = new EndpointRegistry(
                upstreamConfig.mirrors(),
                upstreamConfig.pageviewsBaseUrl(),
                client,
                new RetryExecutor(),
                settings,
                clock);

        LOG.infov(
                "Content access configured: mirrors={0}, cache max={1} ttl={2}, timeout={3}",
                upstreamConfig.mirrors(),
                cacheConfig.maxEntries(),
                cacheConfig.ttl(),
                settings.requestTimeout());
        return new ServiceContext(cache, new RequestDeduplicator(), registry, monitoring);
    }

    @Produces
    @Singleton
    public ContentUseCase contentUseCase(ServiceContext context, ObjectMapper objectMapper, Clock clock) {
        return new ContentService(
                context,
                new WikiResponseDecoder(objectMapper),
                upstreamConfig.defaultLanguage(),
                upstreamConfig.deduplicationEnabled(),
                clock);
    }
}
