package wikigate.core.service.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import wikigate.core.model.common.WikiAccessException;
import wikigate.core.model.resilience.CircuitBreakerPolicy;
import wikigate.core.model.resilience.EndpointStatus;
import wikigate.core.model.resilience.ResilienceSettings;
import wikigate.core.model.resilience.RetryPolicy;
import wikigate.support.FakeUpstreamClient;
import wikigate.support.MutableClock;

@DisplayName("EndpointRegistry")
class EndpointRegistryTest {

    private FakeUpstreamClient client;
    private EndpointRegistry registry;

    @BeforeEach
    void setUp() {
        client = new FakeUpstreamClient(url -> FakeUpstreamClient.ok(url, "{}"));
        var settings = new ResilienceSettings(
                new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 2.0, WikiAccessException::isRetryableFailure),
                new CircuitBreakerPolicy(3, Duration.ofSeconds(30)),
                Duration.ofSeconds(10));
        registry = new EndpointRegistry(
                List.of("https://{lang}.wikipedia.org", "https://{lang}.m.wikipedia.org"),
                "https://wikimedia.org",
                client,
                new RetryExecutor(delay -> Uni.createFrom().voidItem()),
                settings,
                MutableClock.startingAt("2024-05-01T12:00:00Z"));
    }

    @Test
    @DisplayName("should expand mirror templates with the language")
    void shouldExpandTemplates() {
        var manager = registry.forLanguage("de");

        var urls = manager.getEndpointStatus().stream().map(EndpointStatus::endpoint).toList();

        assertEquals(List.of("https://de.wikipedia.org", "https://de.m.wikipedia.org"), urls);
    }

    @Test
    @DisplayName("should reuse the manager of a language")
    void shouldReuseManager() {
        assertSame(registry.forLanguage("fr"), registry.forLanguage("fr"));
    }

    @Test
    @DisplayName("should route pageviews requests to the pageviews host")
    void shouldRoutePageviews() {
        registry.pageviews().fetch("/api/rest_v1/metrics/x").await().indefinitely();

        assertEquals(List.of("https://wikimedia.org/api/rest_v1/metrics/x"), client.calls());
    }

    @Test
    @DisplayName("should report every manager sorted by language, pageviews last")
    void shouldReportStatus() {
        registry.forLanguage("fr");
        registry.forLanguage("de");

        var status = registry.getEndpointStatus();

        assertEquals(List.of("de", "fr", "pageviews"), List.copyOf(status.keySet()));
        assertEquals(2, status.get("de").size());
        assertEquals(1, status.get("pageviews").size());
    }
}
