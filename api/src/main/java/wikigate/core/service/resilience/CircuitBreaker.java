package wikigate.core.service.resilience;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wikigate.core.model.common.CircuitOpenException;
import wikigate.core.model.resilience.CircuitBreakerPolicy;
import wikigate.core.model.resilience.CircuitBreakerStatus;
import wikigate.core.model.resilience.CircuitState;

/**
 * Failure-tracking gate for a single upstream mirror.
 *
 * <p>State machine:
 * <ul>
 *   <li><b>CLOSED</b>: calls run; a counted failure increments the failure
 *       count, a success resets it. Reaching the threshold opens the circuit.</li>
 *   <li><b>OPEN</b>: calls fail fast with {@link CircuitOpenException} without
 *       running. Once {@code resetTimeout} has passed since the last failure,
 *       the next call is admitted as the probe and the state moves to HALF_OPEN.</li>
 *   <li><b>HALF_OPEN</b>: only the probe runs; concurrent callers fail fast.
 *       Probe success closes the circuit, probe failure re-opens it and
 *       restarts the reset timer.</li>
 * </ul>
 *
 * <p>Only the probe's outcome moves the breaker out of HALF_OPEN. A call
 * admitted while CLOSED that completes after the circuit opened does not
 * touch the state, the timer or the probe gate.
 *
 * <p>Thread-safety: admission and outcome transitions synchronize on the
 * breaker; the operation itself runs outside the lock.
 */
public class CircuitBreaker {

    private static final Logger LOG = Logger.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerPolicy policy;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private long lastFailureTime;
    private boolean probeInFlight;

    public CircuitBreaker(String name, CircuitBreakerPolicy policy) {
        this(name, policy, Clock.systemUTC());
    }

    /**
     * @param name   identifies the protected mirror in logs and errors
     * @param policy failure threshold and reset timeout
     * @param clock  time source for the reset timer
     */
    public CircuitBreaker(String name, CircuitBreakerPolicy policy, Clock clock) {
        this.name = name;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Runs the operation through the breaker.
     *
     * <p>The returned Uni is lazy: admission is decided at subscription time.
     *
     * @param operation supplies the protected call
     * @param <T>       the result type
     * @return the operation's outcome, or a {@link CircuitOpenException} failure
     */
    public <T> Uni<T> execute(Supplier<Uni<T>> operation) {
        return Uni.createFrom().deferred(() -> {
            final var admission = admit();
            if (admission == Admission.REJECTED) {
                return Uni.createFrom().failure(new CircuitOpenException(name));
            }

            final Uni<T> call;
            try {
                call = operation.get();
            } catch (RuntimeException e) {
                onFailure(e, admission);
                return Uni.createFrom().failure(e);
            }

            return call.onItem()
                    .invoke(item -> onSuccess(admission))
                    .onFailure()
                    .invoke(error -> onFailure(error, admission))
                    .onCancellation()
                    .invoke(() -> {
                        if (admission == Admission.PROBE) {
                            releaseProbe();
                        }
                    });
        });
    }

    /**
     * Returns a snapshot of the breaker. An OPEN breaker whose reset timeout
     * has elapsed is still reported as OPEN until a call probes it.
     */
    public synchronized CircuitBreakerStatus status() {
        final var lastFailure = failureCount == 0 && state == CircuitState.CLOSED
                ? null
                : Instant.ofEpochMilli(lastFailureTime);
        return new CircuitBreakerStatus(state, failureCount, lastFailure);
    }

    public synchronized CircuitState state() {
        return state;
    }

    public String name() {
        return name;
    }

    private synchronized Admission admit() {
        switch (state) {
            case CLOSED:
                return Admission.PERMITTED;
            case OPEN:
                if (clock.millis() - lastFailureTime > policy.resetTimeout().toMillis()) {
                    state = CircuitState.HALF_OPEN;
                    probeInFlight = true;
                    LOG.infov("Circuit for {0} is HALF_OPEN, admitting probe", name);
                    return Admission.PROBE;
                }
                return Admission.REJECTED;
            case HALF_OPEN:
                if (!probeInFlight) {
                    probeInFlight = true;
                    return Admission.PROBE;
                }
                return Admission.REJECTED;
            default:
                throw new IllegalStateException("Unknown circuit state: " + state);
        }
    }

    private synchronized void onSuccess(Admission admission) {
        if (admission == Admission.PROBE) {
            LOG.infov("Circuit for {0} is CLOSED again", name);
            state = CircuitState.CLOSED;
            probeInFlight = false;
            failureCount = 0;
        } else if (state == CircuitState.CLOSED) {
            failureCount = 0;
        }
    }

    private synchronized void onFailure(Throwable error, Admission admission) {
        if (admission == Admission.PROBE) {
            failureCount++;
            lastFailureTime = clock.millis();
            state = CircuitState.OPEN;
            probeInFlight = false;
            LOG.warnv("Probe for {0} failed, circuit re-opened: {1}", name, error.getMessage());
        } else if (state == CircuitState.CLOSED) {
            failureCount++;
            lastFailureTime = clock.millis();
            if (failureCount >= policy.failureThreshold()) {
                state = CircuitState.OPEN;
                LOG.warnv("Circuit for {0} OPEN after {1} consecutive failures", name, failureCount);
            }
        }
    }

    private synchronized void releaseProbe() {
        probeInFlight = false;
    }

    private enum Admission {
        PERMITTED,
        PROBE,
        REJECTED
    }
}
