package matriarch.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the directory record cache.
 *
 * <p>Configuration prefix: {@code matriarch.cache}
 *
 * <p>When {@link #directory()} is set, entries are persisted as JSON files there and
 * survive restarts. Otherwise they are held in memory.
 */
@ConfigMapping(prefix = "matriarch.cache")
public interface CacheConfig {

    /**
     * Enable caching of directory lookups. When disabled every call reaches the directory.
     *
     * @return true if caching is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Directory for persistent cache files.
     *
     * @return cache directory, empty for an in-memory cache
     */
    Optional<String> directory();

    /**
     * Freshness window. Reads past this age are misses.
     *
     * @return entry time-to-live (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration ttl();

    /**
     * Maximum number of in-memory entries.
     *
     * @return max entries (default: 10000)
     */
    @WithDefault("10000")
    long maxEntries();

    /**
     * TTL jitter factor for the in-memory cache (0.0 to 0.5).
     *
     * @return jitter factor (default: 0.1)
     */
    @WithDefault("0.1")
    double jitterFactor();
}
