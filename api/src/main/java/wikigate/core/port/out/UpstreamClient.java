package wikigate.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import wikigate.core.model.resilience.UpstreamResponse;

/**
 * Outbound HTTP GET against a mirror.
 *
 * <p>Implementations emit only 2xx responses. Every other outcome fails with a
 * tagged {@link wikigate.core.model.common.WikiAccessException}:
 * {@code UpstreamHttpException} for non-2xx statuses,
 * {@code UpstreamTimeoutException} when {@code timeout} elapses and
 * {@code UpstreamNetworkException} for connection or DNS failures.
 */
public interface UpstreamClient {

    Uni<UpstreamResponse> get(String url, Duration timeout);
}
