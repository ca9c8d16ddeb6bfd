package wikigate.core.service.resilience;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Coalesces concurrent requests that share a fingerprint into one in-flight operation.
 *
 * <p>The first subscriber for a fingerprint starts the operation; every
 * subscriber that arrives while it is in flight receives the same memoized
 * outcome. The pending entry is removed when the operation terminates
 * (item, failure or cancellation), so a later call starts a fresh operation.
 *
 * <p>Removal is conditional on the entry still being the one created for this
 * flight, which keeps a finished flight from evicting its successor.
 */
public class RequestDeduplicator {

    private static final Logger LOG = Logger.getLogger(RequestDeduplicator.class);

    private final Map<String, Uni<?>> pending = new ConcurrentHashMap<>();

    /**
     * Runs {@code operation} unless an operation with the same fingerprint is in flight.
     *
     * @param fingerprint deterministic key of the logical request
     * @param operation   supplies the operation on first use
     * @param <T>         the result type
     * @return the shared outcome
     */
    @SuppressWarnings("unchecked")
    public <T> Uni<T> deduplicate(String fingerprint, Supplier<Uni<T>> operation) {
        return Uni.createFrom().deferred(() -> {
            final var shared = pending.computeIfAbsent(fingerprint, key -> share(key, operation));
            return (Uni<T>) shared;
        });
    }

    /**
     * Returns the number of fingerprints with an operation in flight.
     */
    public int pendingCount() {
        return pending.size();
    }

    private <T> Uni<T> share(String fingerprint, Supplier<Uni<T>> operation) {
        LOG.debugv("Starting shared operation for {0}", fingerprint);
        final var self = new AtomicReference<Uni<T>>();
        final Uni<T> shared = Uni.createFrom()
                .deferred(operation::get)
                .onTermination()
                .invoke(() -> pending.remove(fingerprint, self.get()))
                .memoize()
                .indefinitely();
        self.set(shared);
        return shared;
    }
}
