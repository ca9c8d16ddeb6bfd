package wikigate.core.service.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wikigate.core.model.common.UpstreamHttpException;
import wikigate.core.model.common.UpstreamTimeoutException;
import wikigate.core.model.common.ValidationException;
import wikigate.core.model.common.WikiAccessException;
import wikigate.core.model.resilience.RetryPolicy;

@DisplayName("RetryExecutor")
class RetryExecutorTest {

    private static final RetryPolicy POLICY = new RetryPolicy(
            3, Duration.ofSeconds(1), Duration.ofSeconds(8), 2.0, WikiAccessException::isRetryableFailure);

    private List<Duration> delays;
    private RetryExecutor executor;
    private AtomicInteger attempts;

    @BeforeEach
    void setUp() {
        delays = new CopyOnWriteArrayList<>();
        executor = new RetryExecutor(delay -> {
            delays.add(delay);
            return Uni.createFrom().voidItem();
        });
        attempts = new AtomicInteger();
    }

    private Uni<String> failingThen(int failures, RuntimeException error) {
        return executor.execute(
                () -> attempts.incrementAndGet() <= failures
                        ? Uni.createFrom().<String>failure(error)
                        : Uni.createFrom().item("done"),
                POLICY);
    }

    @Nested
    @DisplayName("Retryable failures")
    class RetryableFailures {

        @Test
        @DisplayName("should return the first success without waiting")
        void shouldReturnFirstSuccess() {
            assertEquals("done", failingThen(0, null).await().indefinitely());

            assertEquals(1, attempts.get());
            assertTrue(delays.isEmpty());
        }

        @Test
        @DisplayName("should retry until an attempt succeeds")
        void shouldRetryUntilSuccess() {
            var result = failingThen(2, new UpstreamHttpException(503, "https://en.wikipedia.org"))
                    .await()
                    .indefinitely();

            assertEquals("done", result);
            assertEquals(3, attempts.get());
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), delays);
        }

        @Test
        @DisplayName("should rethrow the last failure after maxRetries + 1 attempts")
        void shouldRethrowAfterExhaustion() {
            var timeout = new UpstreamTimeoutException("https://en.wikipedia.org", Duration.ofSeconds(10));

            var thrown = assertThrows(
                    UpstreamTimeoutException.class, () -> failingThen(10, timeout).await().indefinitely());

            assertSame(timeout, thrown);
            assertEquals(4, attempts.get());
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), delays);
        }

        @Test
        @DisplayName("should cap delays at maxDelay")
        void shouldCapDelays() {
            var policy = new RetryPolicy(
                    5, Duration.ofSeconds(1), Duration.ofSeconds(3), 2.0, WikiAccessException::isRetryableFailure);
            var error = new UpstreamHttpException(500, "https://en.wikipedia.org");

            assertThrows(
                    UpstreamHttpException.class,
                    () -> executor.execute(() -> Uni.createFrom().<String>failure(error), policy)
                            .await()
                            .indefinitely());

            assertEquals(
                    List.of(
                            Duration.ofSeconds(1),
                            Duration.ofSeconds(2),
                            Duration.ofSeconds(3),
                            Duration.ofSeconds(3),
                            Duration.ofSeconds(3)),
                    delays);
        }
    }

    @Nested
    @DisplayName("Non-retryable failures")
    class NonRetryableFailures {

        @Test
        @DisplayName("should rethrow a client error immediately")
        void shouldNotRetryClientError() {
            assertThrows(
                    UpstreamHttpException.class,
                    () -> failingThen(10, new UpstreamHttpException(404, "https://en.wikipedia.org"))
                            .await()
                            .indefinitely());

            assertEquals(1, attempts.get());
            assertTrue(delays.isEmpty());
        }

        @Test
        @DisplayName("should rethrow a validation error immediately")
        void shouldNotRetryValidationError() {
            assertThrows(
                    ValidationException.class,
                    () -> failingThen(10, new ValidationException("query", "must not be blank"))
                            .await()
                            .indefinitely());

            assertEquals(1, attempts.get());
        }

        @Test
        @DisplayName("should not retry untyped failures")
        void shouldNotRetryUntypedFailures() {
            assertThrows(
                    IllegalStateException.class,
                    () -> failingThen(10, new IllegalStateException("bug")).await().indefinitely());

            assertEquals(1, attempts.get());
        }
    }
}
