package wikigate.core.cache;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the content cache.
 *
 * <p>Configuration prefix: {@code wikigate.cache.local}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code WIKIGATE_CACHE_LOCAL_MAX_ENTRIES} - e.g., "100"</li>
 *   <li>{@code WIKIGATE_CACHE_LOCAL_TTL} - e.g., "PT5M" for five minutes</li>
 * </ul>
 */
@ConfigMapping(prefix = "wikigate.cache.local")
public interface LocalCacheConfig {

    /**
     * Maximum number of decoded results held in memory.
     *
     * <p>When exceeded, the least recently used entry is evicted.
     *
     * @return maximum entries (default: 100)
     */
    @WithDefault("100")
    long maxEntries();

    /**
     * Default time-to-live for cached results.
     *
     * @return TTL duration (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration ttl();
}
