package matriarch.adapter.out.cache;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import matriarch.core.model.cache.CacheEntry;
import matriarch.core.model.cache.CacheKey;
import matriarch.core.port.out.DirectoryCache;

/**
 * Cache used when caching is disabled. Every read is a miss and writes are dropped.
 */
public final class NoOpDirectoryCache implements DirectoryCache {

    public static final NoOpDirectoryCache INSTANCE = new NoOpDirectoryCache();

    private NoOpDirectoryCache() {}

    @Override
    public Uni<Optional<CacheEntry>> get(CacheKey key) {
        return Uni.createFrom().item(Optional.empty());
    }

    @Override
    public Uni<Void> put(CacheKey key, CacheEntry entry) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Void> invalidate(CacheKey key) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Void> invalidateAll() {
        return Uni.createFrom().voidItem();
    }
}
