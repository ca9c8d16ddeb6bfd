package wikigate.core.service.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.UniEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import wikigate.core.model.common.UpstreamHttpException;

@DisplayName("RequestDeduplicator")
class RequestDeduplicatorTest {

    private RequestDeduplicator deduplicator;
    private AtomicInteger invocations;
    private AtomicReference<UniEmitter<? super String>> emitter;

    @BeforeEach
    void setUp() {
        deduplicator = new RequestDeduplicator();
        invocations = new AtomicInteger();
        emitter = new AtomicReference<>();
    }

    private Uni<String> pending(String fingerprint) {
        return deduplicator.deduplicate(fingerprint, () -> {
            invocations.incrementAndGet();
            return Uni.createFrom().<String>emitter(emitter::set);
        });
    }

    @Test
    @DisplayName("should run the operation once for concurrent callers")
    void shouldShareInFlightOperation() {
        var results = new CopyOnWriteArrayList<String>();
        for (int i = 0; i < 3; i++) {
            pending("search:en:cat").subscribe().with(results::add);
        }

        assertEquals(1, invocations.get());
        assertEquals(1, deduplicator.pendingCount());

        emitter.get().complete("result");

        assertEquals(List.of("result", "result", "result"), results);
        assertEquals(0, deduplicator.pendingCount());
    }

    @Test
    @DisplayName("should run the operation again after settlement")
    void shouldRunAgainAfterSettlement() {
        var first = deduplicator.deduplicate("k", () -> {
            invocations.incrementAndGet();
            return Uni.createFrom().item("one");
        });
        assertEquals("one", first.await().indefinitely());

        var second = deduplicator.deduplicate("k", () -> {
            invocations.incrementAndGet();
            return Uni.createFrom().item("two");
        });

        assertEquals("two", second.await().indefinitely());
        assertEquals(2, invocations.get());
    }

    @Test
    @DisplayName("should share a failure and remove the entry")
    void shouldShareFailure() {
        var failures = new CopyOnWriteArrayList<Throwable>();
        pending("k").subscribe().with(item -> {}, failures::add);
        pending("k").subscribe().with(item -> {}, failures::add);

        var error = new UpstreamHttpException(503, "https://en.wikipedia.org");
        emitter.get().fail(error);

        assertEquals(2, failures.size());
        assertSame(error, failures.get(0));
        assertSame(error, failures.get(1));
        assertEquals(0, deduplicator.pendingCount());
        assertEquals(1, invocations.get());
    }

    @Test
    @DisplayName("should keep different fingerprints independent")
    void shouldKeepFingerprintsIndependent() {
        pending("a").subscribe().with(item -> {});
        pending("b").subscribe().with(item -> {});

        assertEquals(2, invocations.get());
        assertEquals(2, deduplicator.pendingCount());
    }
}
