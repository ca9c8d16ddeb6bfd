package wikigate.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Size-bounded LRU cache with per-entry TTL.
 *
 * <p>Entries are kept in recency order: {@link #get} and {@link #put} move an
 * entry to the most recent end, and a put at capacity evicts the least
 * recently used entry before inserting. {@link #contains} does not change
 * recency. Expired entries are never returned and are dropped when they are
 * touched, or ahead of LRU eviction when the cache is full.
 *
 * <p>Thread-safety: all operations synchronize on the cache instance. The
 * critical sections are map lookups only, no I/O.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class TtlLruCache<K, V> implements LocalCache<K, V> {

    // Insertion order; recency is refreshed by re-inserting
    private final LinkedHashMap<K, Entry<V>> entries = new LinkedHashMap<>();
    private final long maxSize;
    private final Duration defaultTtl;
    private final Clock clock;

    /**
     * Create a cache using the system clock.
     *
     * @param defaultTtl the TTL applied by {@link #put(Object, Object)}
     * @param maxSize    the maximum number of entries
     */
    public TtlLruCache(Duration defaultTtl, long maxSize) {
        this(defaultTtl, maxSize, Clock.systemUTC());
    }

    /**
     * Create a cache with an explicit clock.
     *
     * @param defaultTtl the TTL applied by {@link #put(Object, Object)}
     * @param maxSize    the maximum number of entries, at least 1
     * @param clock      time source for insertion and expiry
     */
    public TtlLruCache(Duration defaultTtl, long maxSize, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Cache max size must be at least 1, got: " + maxSize);
        }
        if (defaultTtl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must not be negative, got: " + defaultTtl);
        }
        this.defaultTtl = defaultTtl;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    @Override
    public synchronized Optional<V> get(K key) {
        final var entry = liveEntry(key);
        if (entry == null) {
            return Optional.empty();
        }
        entries.remove(key);
        entries.put(key, entry);
        return Optional.of(entry.value());
    }

    @Override
    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    @Override
    public synchronized void put(K key, V value, Duration ttl) {
        final var now = clock.millis();
        if (!entries.containsKey(key) && entries.size() >= maxSize) {
            purgeExpired(now);
            evictEldestUntilBelow(maxSize);
        }
        entries.remove(key);
        entries.put(key, new Entry<>(value, now, now + ttl.toMillis()));
    }

    @Override
    public synchronized boolean contains(K key) {
        return liveEntry(key) != null;
    }

    @Override
    public synchronized void invalidate(K key) {
        entries.remove(key);
    }

    @Override
    public synchronized void invalidateAll() {
        entries.clear();
    }

    @Override
    public synchronized long estimatedSize() {
        return entries.size();
    }

    @Override
    public long maxSize() {
        return maxSize;
    }

    private Entry<V> liveEntry(K key) {
        final var entry = entries.get(key);
        if (entry != null && entry.isExpired(clock.millis())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private void purgeExpired(long now) {
        entries.values().removeIf(entry -> entry.isExpired(now));
    }

    private void evictEldestUntilBelow(long limit) {
        final Iterator<Map.Entry<K, Entry<V>>> iterator = entries.entrySet().iterator();
        while (entries.size() >= limit && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
        }
    }

    private record Entry<V>(V value, long insertedAt, long expiresAt) {
        boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
