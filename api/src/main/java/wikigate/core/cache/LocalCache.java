package wikigate.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Local in-memory cache with size bound and TTL expiry.
 *
 * <p>Holds decoded upstream results keyed by request fingerprint. A miss
 * (absent or expired key) is a normal outcome and is reported as an empty
 * {@link Optional}, never as an error.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return Optional containing the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Puts a value into the cache using the default TTL.
     *
     * @param key   the cache key
     * @param value the value to cache
     */
    void put(K key, V value);

    /**
     * Puts a value into the cache with an explicit TTL for this entry.
     *
     * @param key   the cache key
     * @param value the value to cache
     * @param ttl   time-to-live for this entry
     */
    void put(K key, V value, Duration ttl);

    /**
     * Checks whether a live (non-expired) entry exists for the key.
     *
     * @param key the cache key
     * @return true if a live entry exists
     */
    boolean contains(K key);

    /**
     * Invalidates (removes) a specific cache entry.
     *
     * @param key the cache key to invalidate
     */
    void invalidate(K key);

    /**
     * Invalidates all entries in the cache.
     */
    void invalidateAll();

    /**
     * Returns the number of entries currently held, including entries that
     * have expired but not yet been purged.
     *
     * @return estimated entry count
     */
    long estimatedSize();

    /**
     * Returns the configured maximum number of entries.
     */
    long maxSize();
}
