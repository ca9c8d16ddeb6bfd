package wikigate.core.service.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wikigate.core.model.common.AllEndpointsFailedException;
import wikigate.core.model.common.CircuitOpenException;
import wikigate.core.model.common.UpstreamNetworkException;
import wikigate.core.model.common.UpstreamTimeoutException;
import wikigate.core.model.common.WikiAccessException;
import wikigate.core.model.resilience.CircuitBreakerPolicy;
import wikigate.core.model.resilience.EndpointStatus;
import wikigate.core.model.resilience.RetryPolicy;
import wikigate.core.model.resilience.UpstreamResponse;
import wikigate.core.port.out.UpstreamClient;

/**
 * Resilient fetch over an ordered list of equivalent mirrors.
 *
 * <p>A pass tries every mirror once, starting at the preferred mirror and
 * wrapping around. Each attempt goes through the mirror's own
 * {@link CircuitBreaker} and is bounded by the request timeout. The first
 * success becomes the preferred mirror for later calls.
 *
 * <p>Within a pass:
 * <ul>
 *   <li>an open circuit moves on to the next mirror; if every circuit was open
 *       the pass fails with {@link CircuitOpenException};</li>
 *   <li>any other failure, including every non-2xx status, counts against the
 *       mirror's breaker and is remembered before the next mirror is tried;
 *       the pass fails with the last such failure.</li>
 * </ul>
 *
 * <p>The {@link RetryExecutor} decides whether to run another pass. A
 * retryable failure that survives every pass is raised as
 * {@link AllEndpointsFailedException}; non-retryable failures propagate as-is.
 */
public class EndpointManager {

    private static final Logger LOG = Logger.getLogger(EndpointManager.class);

    private final String name;
    private final List<Mirror> mirrors;
    private final UpstreamClient client;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final Duration requestTimeout;
    private final AtomicInteger preferredIndex = new AtomicInteger(0);

    /**
     * @param name           label for logs, e.g. the content language
     * @param baseUrls       mirror base URLs in preference order, at least one
     * @param client         outbound HTTP client
     * @param retryExecutor  runs whole passes with backoff
     * @param retryPolicy    retry limits for whole passes
     * @param breakerPolicy  thresholds for every mirror's breaker
     * @param requestTimeout bound for a single mirror attempt
     * @param clock          time source for the breakers
     */
    public EndpointManager(
            String name,
            List<String> baseUrls,
            UpstreamClient client,
            RetryExecutor retryExecutor,
            RetryPolicy retryPolicy,
            CircuitBreakerPolicy breakerPolicy,
            Duration requestTimeout,
            Clock clock) {
        if (baseUrls == null || baseUrls.isEmpty()) {
            throw new IllegalArgumentException("At least one mirror is required for " + name);
        }
        this.name = name;
        this.client = client;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.requestTimeout = requestTimeout;
        this.mirrors = baseUrls.stream()
                .map(url -> new Mirror(url, new CircuitBreaker(url, breakerPolicy, clock)))
                .toList();
    }

    /**
     * Fetches {@code path} (including its query string) from the first mirror
     * that answers successfully.
     *
     * @param path path and query appended to the mirror base URL
     * @return the successful response
     */
    public Uni<UpstreamResponse> fetch(String path) {
        return retryExecutor
                .execute(() -> runPass(path), retryPolicy)
                .onFailure(retryPolicy::isRetryable)
                .transform(error -> {
                    LOG.errorv("All endpoints of {0} failed for {1}: {2}", name, path, error.getMessage());
                    return new AllEndpointsFailedException(path, error);
                });
    }

    /**
     * Returns the breaker status of every mirror, in configured order.
     */
    public List<EndpointStatus> getEndpointStatus() {
        final var preferred = preferredIndex.get();
        return IntStream.range(0, mirrors.size())
                .mapToObj(i -> new EndpointStatus(
                        mirrors.get(i).baseUrl(), mirrors.get(i).breaker().status(), i == preferred))
                .toList();
    }

    /**
     * Returns the base URL the next pass starts with.
     */
    public String preferredEndpoint() {
        return mirrors.get(preferredIndex.get()).baseUrl();
    }

    public String name() {
        return name;
    }

    private Uni<UpstreamResponse> runPass(String path) {
        return tryMirror(path, preferredIndex.get(), 0, new PassFailures());
    }

    private Uni<UpstreamResponse> tryMirror(String path, int start, int offset, PassFailures failures) {
        if (offset >= mirrors.size()) {
            return Uni.createFrom().failure(failures.terminal());
        }

        final var index = (start + offset) % mirrors.size();
        final var mirror = mirrors.get(index);
        final var url = mirror.baseUrl() + path;

        return mirror.breaker()
                .execute(() -> call(url))
                .onItem()
                .invoke(response -> markPreferred(index))
                .onFailure()
                .recoverWithUni(error -> {
                    failures.record(error);
                    LOG.warnv("Endpoint {0} failed: {1}", mirror.baseUrl(), error.getMessage());
                    return tryMirror(path, start, offset + 1, failures);
                });
    }

    private Uni<UpstreamResponse> call(String url) {
        return client.get(url, requestTimeout)
                .ifNoItem()
                .after(requestTimeout)
                .failWith(() -> new UpstreamTimeoutException(url, requestTimeout))
                .onFailure(error -> !(error instanceof WikiAccessException))
                .transform(error -> new UpstreamNetworkException("Request to " + url + " failed: " + error, error));
    }

    private void markPreferred(int index) {
        final var previous = preferredIndex.getAndSet(index);
        if (previous != index) {
            LOG.infov("Preferred endpoint of {0} is now {1}", name, mirrors.get(index).baseUrl());
        }
    }

    private record Mirror(String baseUrl, CircuitBreaker breaker) {}

    /**
     * Failures seen during one pass.
     */
    private static final class PassFailures {
        private Throwable lastConcrete;
        private CircuitOpenException lastOpen;

        void record(Throwable error) {
            if (error instanceof CircuitOpenException open) {
                lastOpen = open;
            } else {
                lastConcrete = error;
            }
        }

        Throwable terminal() {
            return lastConcrete != null ? lastConcrete : lastOpen;
        }
    }
}
