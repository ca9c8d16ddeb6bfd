package wikigate.core.service.resilience;

import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wikigate.core.model.resilience.RetryPolicy;

/**
 * Retries a lazily supplied operation with exponential backoff.
 *
 * <p>On failure:
 * <ul>
 *   <li>not retryable per the policy: the failure propagates immediately;</li>
 *   <li>{@code maxRetries + 1} attempts made: the last failure propagates;</li>
 *   <li>otherwise: wait the current delay, grow it by the multiplier (capped
 *       at {@code maxDelay}) and try again.</li>
 * </ul>
 */
public class RetryExecutor {

    private static final Logger LOG = Logger.getLogger(RetryExecutor.class);

    private final BackoffTimer timer;

    public RetryExecutor() {
        this(BackoffTimer.mutiny());
    }

    public RetryExecutor(BackoffTimer timer) {
        this.timer = timer;
    }

    /**
     * Executes the operation under the given policy.
     *
     * @param operation supplies a fresh attempt each time it is called
     * @param policy    retry limits and retryability predicate
     * @param <T>       the result type
     * @return the first successful result, or the terminal failure
     */
    public <T> Uni<T> execute(Supplier<Uni<T>> operation, RetryPolicy policy) {
        return attempt(operation, policy, 0, policy.baseDelay());
    }

    private <T> Uni<T> attempt(Supplier<Uni<T>> operation, RetryPolicy policy, int attempt, Duration delay) {
        return Uni.createFrom().deferred(operation::get).onFailure().recoverWithUni(error -> {
            if (!policy.isRetryable(error)) {
                LOG.debugv("Not retrying after attempt {0}: {1}", attempt + 1, error.getMessage());
                return Uni.createFrom().failure(error);
            }
            if (attempt >= policy.maxRetries()) {
                LOG.debugv("Retries exhausted after {0} attempts: {1}", attempt + 1, error.getMessage());
                return Uni.createFrom().failure(error);
            }

            LOG.debugv(
                    "Attempt {0} failed ({1}), retrying in {2}ms",
                    attempt + 1, error.getMessage(), delay.toMillis());
            final var next = policy.nextDelay(delay);
            return timer.sleep(delay).onItem().transformToUni(ignored -> attempt(operation, policy, attempt + 1, next));
        });
    }
}
