package wikigate.core.service.resilience;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

/**
 * Non-blocking wait used between retry attempts.
 */
@FunctionalInterface
public interface BackoffTimer {

    /**
     * Returns a Uni that completes once {@code delay} has elapsed.
     */
    Uni<Void> sleep(Duration delay);

    /**
     * Timer backed by Mutiny's delayed emission on the default scheduler.
     */
    static BackoffTimer mutiny() {
        return delay -> delay.isZero()
                ? Uni.createFrom().voidItem()
                : Uni.createFrom().voidItem().onItem().delayIt().by(delay);
    }
}
