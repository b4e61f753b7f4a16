package matriarch.adapter.out.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.smallrye.mutiny.Uni;

import matriarch.core.model.cache.CacheEntry;
import matriarch.core.model.cache.CacheKey;
import matriarch.core.port.out.DirectoryCache;

/**
 * Caffeine-backed in-memory directory cache with TTL jitter.
 *
 * <p>
 * Each entry's lifetime is the configured TTL shortened by a random fraction of
 * up to {@code jitterFactor}, so entries fetched together do not all expire
 * together. Jitter never extends an entry past the TTL, and reads also check the
 * entry's fetch time.
 */
public class LocalDirectoryCache implements DirectoryCache {

    private final Cache<CacheKey, CacheEntry> cache;
    private final Duration ttl;
    private final long ttlNanos;
    private final double jitterFactor;
    private final Clock clock;

    /**
     * Create a new in-memory cache.
     *
     * @param ttl          freshness window
     * @param maxEntries   maximum number of entries
     * @param jitterFactor jitter factor (0.0 to 0.5). Set to 0 to disable jitter.
     */
    public LocalDirectoryCache(Duration ttl, long maxEntries, double jitterFactor) {
        this(ttl, maxEntries, jitterFactor, Clock.systemUTC());
    }

    LocalDirectoryCache(Duration ttl, long maxEntries, double jitterFactor, Clock clock) {
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        this.ttl = ttl;
        this.ttlNanos = ttl.toNanos();
        this.jitterFactor = jitterFactor;
        this.clock = clock;

        if (jitterFactor == 0.0) {
            this.cache = Caffeine.newBuilder()
                    .expireAfterWrite(ttl)
                    .maximumSize(maxEntries)
                    .build();
        } else {
            this.cache = Caffeine.newBuilder()
                    .expireAfter(new JitteredExpiry())
                    .maximumSize(maxEntries)
                    .build();
        }
    }

    private class JitteredExpiry implements Expiry<CacheKey, CacheEntry> {
        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry value, long currentTime) {
            return jittered();
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return jittered();
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long jittered() {
            // multiplier in [1 - jitterFactor, 1]
            final var multiplier = 1.0 - ThreadLocalRandom.current().nextDouble() * jitterFactor;
            return (long) (ttlNanos * multiplier);
        }
    }

    @Override
    public Uni<Optional<CacheEntry>> get(CacheKey key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(cache.getIfPresent(key))
                .filter(entry -> entry.isFresh(ttl, clock.instant())));
    }

    @Override
    public Uni<Void> put(CacheKey key, CacheEntry entry) {
        return Uni.createFrom().item(() -> {
                    cache.put(key, entry);
                    return entry;
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> invalidate(CacheKey key) {
        return Uni.createFrom().item(key).invoke(cache::invalidate).replaceWithVoid();
    }

    @Override
    public Uni<Void> invalidateAll() {
        return Uni.createFrom().item(cache).invoke(Cache::invalidateAll).replaceWithVoid();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
