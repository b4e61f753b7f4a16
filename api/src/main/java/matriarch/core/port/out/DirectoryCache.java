package matriarch.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import matriarch.core.model.cache.CacheEntry;
import matriarch.core.model.cache.CacheKey;

/**
 * Port for caching directory records per principal and record kind.
 *
 * <p>Entries past their freshness window are never returned. Implementations
 * treat their own failures as misses and dropped writes.
 */
public interface DirectoryCache {

    /**
     * Get a fresh entry.
     *
     * @param key the cache key
     * @return Uni with the entry, or empty on a miss
     */
    Uni<Optional<CacheEntry>> get(CacheKey key);

    /**
     * Store an entry, replacing any previous one.
     *
     * @param key   the cache key
     * @param entry the entry
     */
    Uni<Void> put(CacheKey key, CacheEntry entry);

    /**
     * Remove an entry.
     *
     * @param key the cache key
     */
    Uni<Void> invalidate(CacheKey key);

    /**
     * Remove every entry.
     */
    Uni<Void> invalidateAll();
}
