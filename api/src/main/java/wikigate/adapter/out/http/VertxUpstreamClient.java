package wikigate.adapter.out.http;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import wikigate.core.config.ResiliencyConfig;
import wikigate.core.model.common.UpstreamHttpException;
import wikigate.core.model.common.UpstreamNetworkException;
import wikigate.core.model.common.UpstreamTimeoutException;
import wikigate.core.model.common.WikiAccessException;
import wikigate.core.model.resilience.UpstreamResponse;
import wikigate.core.port.out.UpstreamClient;

/**
 * Upstream client backed by the Vert.x Mutiny {@link WebClient}.
 *
 * <p>Every request carries the configured User-Agent and JSON Accept header.
 * Outcomes are tagged for the resilience layer: non-2xx statuses become
 * {@link UpstreamHttpException}, request timeouts become
 * {@link UpstreamTimeoutException} and any other failure becomes
 * {@link UpstreamNetworkException}.
 */
@ApplicationScoped
public class VertxUpstreamClient implements UpstreamClient {

    private static final Logger LOG = Logger.getLogger(VertxUpstreamClient.class);

    private final WebClient webClient;

    @Inject
    public VertxUpstreamClient(Vertx vertx, ResiliencyConfig config) {
        this(WebClient.create(vertx, new WebClientOptions().setUserAgent(config.http().userAgent())));
    }

    VertxUpstreamClient(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Uni<UpstreamResponse> get(String url, Duration timeout) {
        final var startTime = System.currentTimeMillis();
        LOG.debugf("Upstream GET %s", url);

        return webClient
                .getAbs(url)
                .timeout(timeout.toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .map(response -> {
                    final var duration = System.currentTimeMillis() - startTime;
                    final var status = response.statusCode();
                    LOG.debugf("Upstream GET %s returned %d in %dms", url, status, duration);
                    if (status < 200 || status >= 300) {
                        throw new UpstreamHttpException(status, url);
                    }
                    return new UpstreamResponse(url, status, response.bodyAsString());
                })
                .onFailure(error -> !(error instanceof WikiAccessException))
                .transform(error -> {
                    if (error instanceof TimeoutException) {
                        return new UpstreamTimeoutException(url, timeout);
                    }
                    return new UpstreamNetworkException("Request to " + url + " failed: " + error.getMessage(), error);
                });
    }
}
